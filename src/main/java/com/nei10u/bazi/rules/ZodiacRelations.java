package com.nei10u.bazi.rules;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 生肖三合、六合、相冲、相害。 */
@Data
public class ZodiacRelations {
    private Map<String, List<String>> tripleHarmony = new LinkedHashMap<>();
    private Map<String, String> sixHarmony = new LinkedHashMap<>();
    private Map<String, String> clash = new LinkedHashMap<>();
    private Map<String, String> harm = new LinkedHashMap<>();

    public boolean isEmpty() {
        return tripleHarmony.isEmpty() && sixHarmony.isEmpty() && clash.isEmpty() && harm.isEmpty();
    }
}
