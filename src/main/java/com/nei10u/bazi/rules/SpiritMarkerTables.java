package com.nei10u.bazi.rules;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 吉神查表数据，键与值均为干支文字。
 */
@Data
public class SpiritMarkerTables {
    /** 日干 → 天乙贵人地支 */
    private Map<String, List<String>> tianYi = new LinkedHashMap<>();
    /** 日干 → 文昌贵人地支 */
    private Map<String, String> wenChang = new LinkedHashMap<>();
    /** 年支 → 红鸾 */
    private Map<String, String> hongLuan = new LinkedHashMap<>();
    /** 年支 → 天喜 */
    private Map<String, String> tianXi = new LinkedHashMap<>();
    /** 年支或日支 → 桃花地支 */
    private Map<String, List<String>> taoHua = new LinkedHashMap<>();

    public boolean isEmpty() {
        return tianYi.isEmpty() && wenChang.isEmpty() && hongLuan.isEmpty()
                && tianXi.isEmpty() && taoHua.isEmpty();
    }
}
