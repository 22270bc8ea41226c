package com.nei10u.bazi.engine;

import com.nlf.calendar.Lunar;
import com.nlf.calendar.Solar;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 lunar-java 节气表。表以农历年为范围，前后各带几个跨年节气（英文键）。
 */
@Component
public class LunarSolarTermSource implements SolarTermSource {

    private static final Map<String, String> JIE_NAMES = new LinkedHashMap<>();

    static {
        for (String name : new String[]{"立春", "惊蛰", "清明", "立夏", "芒种", "小暑",
                "立秋", "白露", "寒露", "立冬", "大雪", "小寒"}) {
            JIE_NAMES.put(name, name);
        }
        // 英文键为跨年节气：DA_XUE 是上一年的大雪，XIAO_HAN、LI_CHUN、JING_ZHE 是下一年的小寒、立春、惊蛰
        JIE_NAMES.put("DA_XUE", "大雪");
        JIE_NAMES.put("XIAO_HAN", "小寒");
        JIE_NAMES.put("LI_CHUN", "立春");
        JIE_NAMES.put("JING_ZHE", "惊蛰");
    }

    @Override
    public List<Term> jieTermsAround(LocalDateTime birth) {
        Lunar lunar = Solar.fromYmdHms(birth.getYear(), birth.getMonthValue(), birth.getDayOfMonth(),
                birth.getHour(), birth.getMinute(), 0).getLunar();
        Map<String, Solar> table = lunar.getJieQiTable();
        List<Term> terms = new ArrayList<>();
        for (Map.Entry<String, String> e : JIE_NAMES.entrySet()) {
            Solar solar = table.get(e.getKey());
            if (solar != null) {
                terms.add(new Term(e.getValue(), LocalDateTime.of(solar.getYear(), solar.getMonth(),
                        solar.getDay(), solar.getHour(), solar.getMinute(), solar.getSecond())));
            }
        }
        return terms;
    }
}
