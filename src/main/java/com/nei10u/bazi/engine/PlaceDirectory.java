package com.nei10u.bazi.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 常见城市经纬度。只做真太阳时的粗略校正，按名称包含关系匹配，城市优先于省份。
 */
final class PlaceDirectory {

    private static final Map<String, Coordinates> PLACES = new LinkedHashMap<>();

    static {
        PLACES.put("北京", new Coordinates(116.4074, 39.9042));
        PLACES.put("上海", new Coordinates(121.4737, 31.2304));
        PLACES.put("天津", new Coordinates(117.2009, 39.0842));
        PLACES.put("重庆", new Coordinates(106.5516, 29.5630));
        PLACES.put("广州", new Coordinates(113.2644, 23.1291));
        PLACES.put("深圳", new Coordinates(114.0579, 22.5431));
        PLACES.put("杭州", new Coordinates(120.1551, 30.2741));
        PLACES.put("南京", new Coordinates(118.7969, 32.0603));
        PLACES.put("成都", new Coordinates(104.0668, 30.5728));
        PLACES.put("西安", new Coordinates(108.9398, 34.3416));
        PLACES.put("武汉", new Coordinates(114.3054, 30.5931));
        PLACES.put("长沙", new Coordinates(112.9388, 28.2282));
        PLACES.put("沈阳", new Coordinates(123.4315, 41.8057));
        PLACES.put("哈尔滨", new Coordinates(126.5350, 45.8038));
        PLACES.put("乌鲁木齐", new Coordinates(87.6168, 43.8256));
        PLACES.put("拉萨", new Coordinates(91.1409, 29.6456));
        PLACES.put("昆明", new Coordinates(102.7123, 25.0406));
        PLACES.put("云南", new Coordinates(102.7123, 25.0406));
        PLACES.put("四川", new Coordinates(104.0668, 30.5728));
        PLACES.put("广东", new Coordinates(113.2644, 23.1291));
        PLACES.put("浙江", new Coordinates(120.1551, 30.2741));
        PLACES.put("江苏", new Coordinates(118.7969, 32.0603));
        PLACES.put("陕西", new Coordinates(108.9398, 34.3416));
        PLACES.put("湖北", new Coordinates(114.3054, 30.5931));
        PLACES.put("湖南", new Coordinates(112.9388, 28.2282));
        PLACES.put("新疆", new Coordinates(87.6168, 43.8256));
        PLACES.put("西藏", new Coordinates(91.1409, 29.6456));
    }

    private PlaceDirectory() {
    }

    static Optional<Coordinates> resolve(String province, String city) {
        Optional<Coordinates> byCity = lookup(city);
        return byCity.isPresent() ? byCity : lookup(province);
    }

    private static Optional<Coordinates> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String n = name.trim();
        for (Map.Entry<String, Coordinates> e : PLACES.entrySet()) {
            if (n.contains(e.getKey()) || e.getKey().contains(n)) {
                return Optional.of(e.getValue());
            }
        }
        return Optional.empty();
    }

    record Coordinates(double longitude, double latitude) {
    }
}
