package com.nei10u.bazi.engine;

import com.nei10u.bazi.exception.InvalidInputException;
import com.nei10u.bazi.model.BirthInput;
import com.nei10u.bazi.model.ChartResult;
import com.nei10u.bazi.model.EarthlyBranch;
import com.nei10u.bazi.model.FourPillarChart;
import com.nei10u.bazi.model.LunarInfo;
import com.nei10u.bazi.model.StemBranchPillar;
import com.nlf.calendar.Lunar;
import com.nlf.calendar.Solar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDateTime;

/**
 * 排盘：出生时间 → 四柱 + 农历信息。
 * 四柱完全由模运算得出（月令按公历月份近似节气），lunar-java 只用于农历、生肖、星座等展示信息。
 */
@Component
public class CalendarEngine {

    private static final Logger log = LoggerFactory.getLogger(CalendarEngine.class);

    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 2100;

    /** 基准经线：东经 120 度。 */
    public static final double REFERENCE_LONGITUDE = 120.0;
    public static final double DEFAULT_LATITUDE = 39.9;

    private static final String[] SEASONS = {
            "冬季", "冬季", "春季", "春季", "春季", "夏季",
            "夏季", "夏季", "秋季", "秋季", "秋季", "冬季"
    };

    private static final String[] APPROXIMATE_TERMS = {
            "小寒后", "立春后", "惊蛰后", "春分后", "立夏后", "芒种后",
            "小暑后", "立秋后", "白露后", "寒露后", "立冬后", "大雪后"
    };

    public ChartResult calculate(BirthInput input) {
        // 1. 校验并得到出生时刻
        LocalDateTime birth = toBirthMoment(input);

        // 2. 经纬度：显式给出 > 省市查表 > 基准经线
        PlaceDirectory.Coordinates coordinates = resolveCoordinates(input);

        // 3. 真太阳时：每差 1 度差 4 分钟，只调整钟点，日期不变
        LocalDateTime chartMoment = input.isTrueSolarTime()
                ? correctSolarTime(birth, coordinates.longitude())
                : birth;

        FourPillarChart chart = buildChart(chartMoment);
        log.debug("排盘完成: {} -> {}", chartMoment, chart);

        return ChartResult.builder()
                .chart(chart)
                .lunarInfo(lunarInfo(birth, chart))
                .birthMoment(birth)
                .chartMoment(chartMoment)
                .solarTimeCorrected(input.isTrueSolarTime())
                .longitude(coordinates.longitude())
                .latitude(coordinates.latitude())
                .build();
    }

    public FourPillarChart buildChart(LocalDateTime moment) {
        StemBranchPillar year = SexagenaryCalculator.yearPillar(moment.getYear());
        StemBranchPillar month = SexagenaryCalculator.monthPillar(year.getStem(), moment.getMonthValue());
        StemBranchPillar day = SexagenaryCalculator.dayPillar(moment.toLocalDate());
        StemBranchPillar hour = SexagenaryCalculator.hourPillar(day.getStem(), moment.getHour());
        return new FourPillarChart(year, month, day, hour);
    }

    /**
     * 按经度校正钟点，跨零点时在当日内回绕。
     */
    public static LocalDateTime correctSolarTime(LocalDateTime moment, double longitude) {
        int offsetMinutes = (int) ((longitude - REFERENCE_LONGITUDE) * 4);
        int minuteOfDay = Math.floorMod(moment.getHour() * 60 + moment.getMinute() + offsetMinutes, 24 * 60);
        return moment.toLocalDate().atTime(minuteOfDay / 60, minuteOfDay % 60);
    }

    static LocalDateTime toBirthMoment(BirthInput input) {
        if (input.getYear() < MIN_YEAR || input.getYear() > MAX_YEAR) {
            throw new InvalidInputException("出生年份需在 " + MIN_YEAR + "-" + MAX_YEAR + " 之间: " + input.getYear());
        }
        if (input.getGender() == null) {
            throw new InvalidInputException("缺少性别");
        }
        try {
            return LocalDateTime.of(input.getYear(), input.getMonth(), input.getDay(),
                    input.getHour(), input.getMinute());
        } catch (DateTimeException e) {
            throw new InvalidInputException("无效的出生日期时间: " + e.getMessage(), e);
        }
    }

    private PlaceDirectory.Coordinates resolveCoordinates(BirthInput input) {
        if (input.getLongitude() != null) {
            double latitude = input.getLatitude() != null ? input.getLatitude() : DEFAULT_LATITUDE;
            return new PlaceDirectory.Coordinates(input.getLongitude(), latitude);
        }
        return PlaceDirectory.resolve(input.getProvince(), input.getCity())
                .orElseGet(() -> new PlaceDirectory.Coordinates(REFERENCE_LONGITUDE, DEFAULT_LATITUDE));
    }

    private LunarInfo lunarInfo(LocalDateTime birth, FourPillarChart chart) {
        Solar solar = Solar.fromYmdHms(birth.getYear(), birth.getMonthValue(), birth.getDayOfMonth(),
                birth.getHour(), birth.getMinute(), 0);
        Lunar lunar = solar.getLunar();
        EarthlyBranch monthBranch = chart.getMonth().getBranch();
        int monthIndex = birth.getMonthValue() - 1;
        // lunar-java 用负数表示闰月
        return LunarInfo.builder()
                .lunarYear(lunar.getYear())
                .lunarMonth(Math.abs(lunar.getMonth()))
                .lunarDay(lunar.getDay())
                .leapMonth(lunar.getMonth() < 0)
                .lunarDate(lunar.toString())
                .zodiac(lunar.getYearShengXiao())
                .constellation(solar.getXingZuo() + "座")
                .season(SEASONS[monthIndex])
                .birthSolarTerm(APPROXIMATE_TERMS[monthIndex])
                .monthCommand(monthBranch.label() + monthBranch.element().label())
                .build();
    }
}
