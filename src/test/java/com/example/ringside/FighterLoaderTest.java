package com.example.ringside;

import com.example.ringside.model.*;
import com.example.ringside.official.FoulType;
import com.example.ringside.util.FighterLoadException;
import com.example.ringside.util.FighterLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FighterLoader Tests")
class FighterLoaderTest {

    // ==================== Resources ====================

    @Test
    @DisplayName("A full definition loads identity, physicals, attributes and tactics")
    void loadsSlugger() throws Exception {
        Fighter f = FighterLoader.loadResource("/fighters/slugger.yaml");
        assertEquals("slugger", f.getId());
        assertEquals("Rocco Slugger", f.getName());
        assertEquals("The Hammer", f.getNickname());

        assertEquals(BodyType.MUSCULAR, f.getPhysical().bodyType());
        assertEquals(Stance.ORTHODOX, f.getPhysical().stance());
        assertEquals(86, f.getPhysical().weight(), 1e-9);

        assertEquals(95, f.getAttribute(Attribute.KNOCKOUT_POWER));
        assertEquals(82, f.getAttribute(Attribute.CHIN));
        assertEquals(88, f.getAttribute(Attribute.HEART));
        assertEquals(Attribute.FOCUS.getDefaultValue(), f.getAttribute(Attribute.FOCUS));

        assertEquals(55, f.getTactics().getDirtiness());
        assertEquals(40, f.getTactics().getTendency(FoulType.HEADBUTT));
        assertEquals(60, f.getTactics().getTendency(FoulType.HOLDING));
        assertEquals(20, f.getTactics().getTendency(FoulType.LOW_BLOW));
    }

    @Test
    @DisplayName("Name and nickname may sit under an identity block, and the id is derived")
    void loadsIdentityBlock() throws Exception {
        Fighter f = FighterLoader.loadResource("/fighters/boxer.yaml");
        assertEquals("Eli Stick", f.getName());
        assertEquals("Professor", f.getNickname());
        assertEquals("eli-stick", f.getId());
        assertEquals(Stance.SOUTHPAW, f.getPhysical().stance());
        assertEquals(BodyType.LANKY, f.getPhysical().bodyType());
        assertEquals(90, f.getAttribute(Attribute.FIGHT_IQ));
        assertEquals(0, f.getTactics().getDirtiness());
    }

    @Test
    @DisplayName("A fighter without a name is rejected")
    void namelessFighter() {
        FighterLoadException e = assertThrows(FighterLoadException.class,
            () -> FighterLoader.loadResource("/fighters/nameless.yaml"));
        assertTrue(e.getMessage().contains("no name"));
    }

    @Test
    @DisplayName("A missing resource is reported, not swallowed")
    void missingResource() {
        assertThrows(FighterLoadException.class, () -> FighterLoader.loadResource("/fighters/nobody.yaml"));
    }

    // ==================== Inline and Files ====================

    @Test
    @DisplayName("Bad values fall back to defaults and unknown keys are skipped")
    void lenientValues() throws Exception {
        Fighter f = FighterLoader.fromYaml(String.join("\n",
            "name: Sloppy Sheet",
            "physical:",
            "  stance: not-a-stance",
            "  weight: heavy",
            "power:",
            "  knockoutPower: lots",
            "  punchingStamina: 140",
            "  rocketFists: 99",
            "tactics:",
            "  foulTendencies:",
            "    biting: 50"));
        assertEquals(Stance.ORTHODOX, f.getPhysical().stance());
        assertEquals(75, f.getPhysical().weight(), 1e-9);
        assertEquals(Attribute.KNOCKOUT_POWER.getDefaultValue(), f.getAttribute(Attribute.KNOCKOUT_POWER));
        assertEquals(Attribute.MAX_VALUE, f.getAttribute(Attribute.PUNCHING_STAMINA));
        assertTrue(f.getTactics().getTendencies().isEmpty());
    }

    @Test
    @DisplayName("Malformed or non-mapping YAML is rejected")
    void malformedYaml() {
        assertThrows(FighterLoadException.class, () -> FighterLoader.fromYaml("- just\n- a list"));
        assertThrows(FighterLoadException.class, () -> FighterLoader.fromYaml("name: [unclosed"));
    }

    @Test
    @DisplayName("Fighters load from files on disk")
    void loadsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("local.yaml");
        Files.writeString(file, "name: Local Hero\nmental:\n  heart: 91\n");
        Fighter f = FighterLoader.loadFile(file);
        assertEquals("local-hero", f.getId());
        assertEquals(91, f.getAttribute(Attribute.HEART));

        assertThrows(FighterLoadException.class, () -> FighterLoader.loadFile(dir.resolve("absent.yaml")));
    }
}
