package com.waterCompliance.complianceDemo.compliance.util;

import com.waterCompliance.complianceDemo.compliance.exception.RuleEvaluationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class UnitConverterTest {

    @Test
    void shouldConvertMilligramsToPartsPerBillion() {
        assertThat(UnitConverter.convert(0.031, "mg/L", "ppb")).isCloseTo(31.0, within(1e-9));
    }

    @Test
    void shouldTreatMicroSignVariantsAsTheSameUnit() {
        assertThat(UnitConverter.convert(12.0, "µg/L", "ug/l")).isEqualTo(12.0);
        assertThat(UnitConverter.convert(12.0, "μg / L", "ppb")).isEqualTo(12.0);
    }

    @Test
    void shouldConvertPartsPerTrillionToNanograms() {
        assertThat(UnitConverter.convert(5.8, "ppt", "ng/L")).isCloseTo(5.8, within(1e-9));
    }

    @Test
    void shouldOnlyConvertCountUnitsToThemselves() {
        assertThat(UnitConverter.convert(250.0, "CFU/mL", "cfu/ml")).isEqualTo(250.0);
        assertThatThrownBy(() -> UnitConverter.convert(1.0, "P/A", "mg/L"))
                .isInstanceOf(RuleEvaluationException.class)
                .hasMessageContaining("Cannot convert");
    }

    @Test
    void shouldAcceptFlagsAndOrganismCountsAsPresenceUnits() {
        assertThat(UnitConverter.isPresenceCompatible("P/A")).isTrue();
        assertThat(UnitConverter.isPresenceCompatible("CFU/100 mL")).isTrue();
        assertThat(UnitConverter.isPresenceCompatible("MPN/100mL")).isTrue();
        assertThat(UnitConverter.isPresenceCompatible("mg/L")).isFalse();
    }

    @Test
    void shouldRejectMissingUnit() {
        assertThatThrownBy(() -> UnitConverter.convert(1.0, " ", "mg/L"))
                .isInstanceOf(RuleEvaluationException.class);
    }
}
