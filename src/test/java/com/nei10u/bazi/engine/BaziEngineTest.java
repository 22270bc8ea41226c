package com.nei10u.bazi.engine;

import com.nei10u.bazi.BaziFixtures;
import com.nei10u.bazi.exception.InvalidInputException;
import com.nei10u.bazi.model.BaziAnalysis;
import com.nei10u.bazi.model.BirthInput;
import com.nei10u.bazi.model.DegradedSection;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.PersonalityDimension;
import com.nei10u.bazi.model.StrengthStatus;
import com.nei10u.bazi.rules.RuleRepository;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BaziEngineTest {

    @Test
    void analyzesSampleChartEndToEnd() {
        BaziAnalysis analysis = BaziFixtures.newEngine().analyze(BaziFixtures.sampleInput());

        assertThat(analysis.getChart().getChart().toString()).isEqualTo("庚午 壬午 庚辰 癸未");
        assertThat(analysis.getElements().getStrength().getStatus()).isEqualTo(StrengthStatus.BALANCED);
        assertThat(analysis.getPattern().getType()).isEqualTo("食神格");
        assertThat(analysis.getSpiritMarkers().getAuspiciousNames()).containsExactly("天乙贵人");
        assertThat(analysis.getMajorCycles().getCycles()).hasSize(10);
        assertThat(analysis.getAnnualCycles()).hasSize(10);
        assertThat(analysis.getAnnualCycles().get(0).getYear()).isEqualTo(1990);
        assertThat(analysis.getPersonality().getScores()).hasSize(PersonalityDimension.values().length);
        assertThat(analysis.getLifeAspects().getInterpersonal().getZodiac()).isEqualTo("马");
        assertThat(analysis.getDegradedSections()).isEmpty();
    }

    @Test
    void sameInputGivesSameAnalysis() {
        BaziEngine engine = BaziFixtures.newEngine();

        BaziAnalysis first = engine.analyze(BaziFixtures.sampleInput());
        BaziAnalysis second = engine.analyze(BaziFixtures.sampleInput());

        assertThat(second).isEqualTo(first);
        assertThat(BaziFixtures.newEngine().analyze(BaziFixtures.sampleInput())).isEqualTo(first);
    }

    @Test
    void annualStartYearOverridesBirthYear() {
        BirthInput input = BirthInput.builder()
                .year(1990).month(5).day(15).hour(14).minute(30)
                .gender(Gender.MALE)
                .annualStartYear(2025)
                .build();

        BaziAnalysis analysis = BaziFixtures.newEngine().analyze(input);

        assertThat(analysis.getAnnualCycles().get(0).getGanZhi()).isEqualTo("乙巳");
        assertThat(analysis.getAnnualCycles().get(9).getYear()).isEqualTo(2034);
    }

    @Test
    void missingRulesAreReportedAsDegraded() {
        BaziEngine engine = BaziFixtures.newEngine(new RuleRepository("classpath:no-such-rules/"));

        BaziAnalysis analysis = engine.analyze(BaziFixtures.sampleInput());

        assertThat(analysis.getDegradedSections()).hasSize(5);
        assertThat(analysis.getSpiritMarkers().getAuspiciousNames()).isEmpty();
        assertThat(analysis.getSpiritMarkers().getInauspiciousNames()).containsExactly("寡宿");
        assertThat(analysis.getPersonality().getCoreTraits()).isEmpty();
    }

    @Test
    void cycleFallbackIsReportedAsDegraded() {
        BaziEngine engine = new BaziEngine(new CalendarEngine(), new ElementAnalyzer(), new TenGodClassifier(),
                new PatternClassifier(), new SpiritMarkerEngine(), new CycleScheduler(birth -> List.of()),
                new AnnualCycleEvaluator(), new PersonalityAnalyzer(), new LifeAspectAnalyzer(),
                new RuleRepository(BaziFixtures.RULES), 10);

        BaziAnalysis analysis = engine.analyze(BaziFixtures.sampleInput());

        assertThat(analysis.getMajorCycles().isFallbackUsed()).isTrue();
        assertThat(analysis.getDegradedSections()).extracting(DegradedSection::getSection).containsExactly("大运");
    }

    @Test
    void invalidInputProducesNoResult() {
        BirthInput input = BirthInput.builder()
                .year(1990).month(13).day(1).hour(0).minute(0)
                .gender(Gender.FEMALE)
                .build();

        assertThatThrownBy(() -> BaziFixtures.newEngine().analyze(input)).isInstanceOf(InvalidInputException.class);
    }
}
