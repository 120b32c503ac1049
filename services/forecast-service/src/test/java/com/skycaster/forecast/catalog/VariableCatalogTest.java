package com.skycaster.forecast.catalog;

import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.WeatherVariable;
import com.skycaster.forecast.exception.UnknownVariableException;
import com.skycaster.forecast.support.TestCatalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VariableCatalog Tests")
class VariableCatalogTest {

    private final VariableCatalog catalog = TestCatalogs.variables();

    @Test
    @DisplayName("Should look up provider group by variable name")
    void shouldLookUpGroup() {
        assertThat(catalog.lookup("ambient_temp(K)")).contains(ProviderGroup.OMEGA);
        assertThat(catalog.lookup("ghi(W/m2)")).contains(ProviderGroup.NOVA);
        assertThat(catalog.lookup("pcph")).contains(ProviderGroup.ARC);
        assertThat(catalog.lookup("snowfall")).isEmpty();
    }

    @Test
    @DisplayName("Should group variables in first-seen group order keeping request order")
    void shouldGroupInFirstSeenOrder() {
        Map<ProviderGroup, List<String>> groups = catalog.groupsFor(
                List.of("ghi(W/m2)", "wind_10m", "albedo", "ct", "ambient_temp(K)"));

        assertThat(groups.keySet()).containsExactly(ProviderGroup.NOVA, ProviderGroup.OMEGA, ProviderGroup.ARC);
        assertThat(groups.get(ProviderGroup.NOVA)).containsExactly("ghi(W/m2)", "albedo");
        assertThat(groups.get(ProviderGroup.OMEGA)).containsExactly("wind_10m", "ambient_temp(K)");
        assertThat(groups.get(ProviderGroup.ARC)).containsExactly("ct");
    }

    @Test
    @DisplayName("Should report every unknown variable at once")
    void shouldReportAllUnknownVariables() {
        assertThatThrownBy(() -> catalog.groupsFor(List.of("ct", "foo", "albedo", "bar")))
                .isInstanceOf(UnknownVariableException.class)
                .satisfies(ex -> assertThat(((UnknownVariableException) ex).getInvalidVariables())
                        .containsExactly("foo", "bar"));
    }

    @Test
    @DisplayName("Inactive variables are treated as unknown")
    void inactiveVariablesAreUnknown() {
        VariableCatalog withInactive = new VariableCatalog(List.of(
                WeatherVariable.builder().name("ct").group(ProviderGroup.ARC).active(false).build(),
                WeatherVariable.builder().name("pc").group(ProviderGroup.ARC).build()));

        assertThat(withInactive.lookup("ct")).isEmpty();
        assertThat(withInactive.describe()).extracting(WeatherVariable::getName).containsExactly("pc");
        assertThat(withInactive.variablesByGroup()).containsOnlyKeys(ProviderGroup.ARC);
    }

    @Test
    @DisplayName("Should reject duplicate variable names")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> new VariableCatalog(List.of(
                WeatherVariable.builder().name("ct").group(ProviderGroup.ARC).build(),
                WeatherVariable.builder().name("ct").group(ProviderGroup.NOVA).build())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ct");
    }

    @Test
    @DisplayName("Should list variables grouped by provider")
    void shouldListVariablesByGroup() {
        Map<ProviderGroup, List<String>> byGroup = catalog.variablesByGroup();

        assertThat(byGroup.get(ProviderGroup.OMEGA)).hasSize(4);
        assertThat(byGroup.get(ProviderGroup.NOVA)).hasSize(7);
        assertThat(byGroup.get(ProviderGroup.ARC)).containsExactly("ct", "pc", "pcph");
    }
}
