package com.example.ringside.official;

import java.util.Map;

public record FoulSummary(int committed, int detected, int warnings, int deductions,
                          boolean disqualified, Map<FoulType, Integer> warningsByType) {
}
