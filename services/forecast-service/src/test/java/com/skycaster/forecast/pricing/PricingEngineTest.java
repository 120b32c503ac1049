package com.skycaster.forecast.pricing;

import com.skycaster.forecast.catalog.CurrencyRate;
import com.skycaster.forecast.catalog.PricingCatalog;
import com.skycaster.forecast.catalog.TaxSettings;
import com.skycaster.forecast.catalog.VariablePricing;
import com.skycaster.forecast.domain.CallerContext;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.SubscriptionTier;
import com.skycaster.forecast.support.TestCatalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("PricingEngine Tests")
class PricingEngineTest {

    private final PricingEngine engine = new PricingEngine();

    private static final List<String> TWO_VARIABLES = List.of("ambient_temp(K)", "ghi(W/m2)");

    private static PricingCatalog tieredCatalog() {
        return TestCatalogs.pricing().toBuilder()
                .variablePrice("ct", VariablePricing.builder()
                        .variableName("ct").group(ProviderGroup.ARC)
                        .basePrice(new BigDecimal("2.00")).currency("INR")
                        .taxRate(new BigDecimal("12")).taxEnabled(true)
                        .tierPrice(SubscriptionTier.BUSINESS, new BigDecimal("1.50"))
                        .tierPrice(SubscriptionTier.FREE, new BigDecimal("3.00"))
                        .build())
                .build();
    }

    @Nested
    @DisplayName("Worked Examples")
    class WorkedExamples {

        @Test
        @DisplayName("2 variables x 2 locations at 1.00 with 18% tax is 4.00 + 0.72 = 4.72")
        void withTax() {
            PricingResult result = engine.price(TWO_VARIABLES, 2, CallerContext.anonymous(), TestCatalogs.pricing());

            assertThat(result.displaySubtotal()).isEqualTo("4.00");
            assertThat(result.displayTaxAmount()).isEqualTo("0.72");
            assertThat(result.displayFinalAmount()).isEqualTo("4.72");
            assertThat(result.displayTaxRate()).isEqualTo("18%");
            assertThat(result.displayTaxApplied()).isEqualTo("Yes");
            assertThat(result.getCurrency()).isEqualTo("INR");
            assertThat(result.isFallbackApplied()).isFalse();
        }

        @Test
        @DisplayName("Tax disabled leaves the final amount equal to the subtotal")
        void withoutTax() {
            PricingCatalog catalog = TestCatalogs.basePricing()
                    .defaultTax(new TaxSettings(new BigDecimal("18"), false))
                    .build();

            PricingResult result = engine.price(TWO_VARIABLES, 2, CallerContext.anonymous(), catalog);

            assertThat(result.displaySubtotal()).isEqualTo("4.00");
            assertThat(result.displayTaxAmount()).isEqualTo("0.00");
            assertThat(result.displayFinalAmount()).isEqualTo("4.00");
            assertThat(result.displayTaxApplied()).isEqualTo("No");
        }

        @Test
        @DisplayName("Overview example matches the worked example")
        void overviewExample() {
            PricingOverview overview = engine.overview(TestCatalogs.pricing());

            assertThat(overview.example().variables()).isEqualTo(2);
            assertThat(overview.example().locations()).isEqualTo(2);
            assertThat(overview.example().result().displayFinalAmount()).isEqualTo("4.72");
            assertThat(overview.entries()).hasSize(TestCatalogs.SEED.size());
            assertThat(overview.currencies()).extracting(CurrencyRate::getCode).contains("INR", "USD", "EUR");
        }
    }

    @Nested
    @DisplayName("Unit Price Tests")
    class UnitPriceTests {

        @Test
        @DisplayName("Caller's own tier override wins over the base price")
        void tierOverride() {
            CallerContext business = CallerContext.builder().subscriptionTier(SubscriptionTier.BUSINESS).build();

            PricingResult result = engine.price(List.of("ct"), 1, business, tieredCatalog());

            assertThat(result.getSubtotal()).isEqualByComparingTo("1.50");
        }

        @Test
        @DisplayName("Tier override is not applied to callers on other tiers")
        void tierOverrideUsesActualTier() {
            CallerContext enterprise = CallerContext.builder().subscriptionTier(SubscriptionTier.ENTERPRISE).build();
            CallerContext free = CallerContext.builder().subscriptionTier(SubscriptionTier.FREE).build();

            assertThat(engine.price(List.of("ct"), 1, enterprise, tieredCatalog()).getSubtotal())
                    .isEqualByComparingTo("2.00");
            assertThat(engine.price(List.of("ct"), 1, free, tieredCatalog()).getSubtotal())
                    .isEqualByComparingTo("3.00");
            assertThat(engine.price(List.of("ct"), 1, CallerContext.anonymous(), tieredCatalog()).getSubtotal())
                    .isEqualByComparingTo("2.00");
        }

        @Test
        @DisplayName("Variables without pricing use the default unit price")
        void defaultPrice() {
            PricingCatalog catalog = TestCatalogs.basePricing()
                    .defaultUnitPrice(new BigDecimal("0.75"))
                    .build();

            PricingResult result = engine.price(List.of("ct", "pc"), 3, CallerContext.anonymous(), catalog);

            assertThat(result.getSubtotal()).isEqualByComparingTo("4.50");
        }

        @Test
        @DisplayName("Subtotal scales linearly with the number of locations")
        void linearScaling() {
            BigDecimal one = engine.price(List.of("ct"), 1, CallerContext.anonymous(), tieredCatalog()).getSubtotal();
            BigDecimal seven = engine.price(List.of("ct"), 7, CallerContext.anonymous(), tieredCatalog()).getSubtotal();

            assertThat(seven).isEqualByComparingTo(one.multiply(BigDecimal.valueOf(7)));
        }

        @Test
        @DisplayName("Tax settings come from the first requested variable with pricing")
        void taxFromFirstPricedVariable() {
            PricingResult result = engine.price(List.of("unpriced", "ct", "pc"), 1, CallerContext.anonymous(), tieredCatalog());

            assertThat(result.getTaxRate()).isEqualByComparingTo("12");
        }
    }

    @Nested
    @DisplayName("Currency Tests")
    class CurrencyTests {

        @Test
        @DisplayName("Explicit preferred currency converts linearly")
        void preferredCurrency() {
            CallerContext caller = CallerContext.builder().preferredCurrency("usd").build();

            PricingResult result = engine.price(TWO_VARIABLES, 2, caller, TestCatalogs.pricing());

            assertThat(result.getCurrency()).isEqualTo("USD");
            assertThat(result.getSubtotal()).isEqualByComparingTo("0.048");
            assertThat(result.getFinalAmount()).isEqualByComparingTo("0.05664");
            assertThat(result.displayFinalAmount()).isEqualTo("0.06");
        }

        @Test
        @DisplayName("Rate of 1.0 leaves amounts unchanged")
        void identityRate() {
            PricingCatalog catalog = TestCatalogs.pricing().toBuilder()
                    .currency("AED", CurrencyRate.builder().code("AED").exchangeRate(BigDecimal.ONE).build())
                    .build();
            CallerContext caller = CallerContext.builder().preferredCurrency("AED").build();

            PricingResult converted = engine.price(TWO_VARIABLES, 2, caller, catalog);
            PricingResult base = engine.price(TWO_VARIABLES, 2, CallerContext.anonymous(), catalog);

            assertThat(converted.getCurrency()).isEqualTo("AED");
            assertThat(converted.getFinalAmount()).isEqualByComparingTo(base.getFinalAmount());
        }

        @Test
        @DisplayName("Country code maps to a currency when no preference is given")
        void countryCurrency() {
            CallerContext caller = CallerContext.builder().countryCode("fr").build();

            PricingResult result = engine.price(TWO_VARIABLES, 2, caller, TestCatalogs.pricing());

            assertThat(result.getCurrency()).isEqualTo("EUR");
            assertThat(result.getSubtotal()).isEqualByComparingTo("0.044");
        }

        @Test
        @DisplayName("Unknown currency stays in the base currency")
        void unknownCurrency() {
            CallerContext caller = CallerContext.builder().preferredCurrency("XYZ").countryCode("US").build();

            PricingResult result = engine.price(TWO_VARIABLES, 2, caller, TestCatalogs.pricing());

            assertThat(result.getCurrency()).isEqualTo("INR");
            assertThat(result.displayFinalAmount()).isEqualTo("4.72");
        }
    }

    @Test
    @DisplayName("Unexpected failure degrades to default pricing")
    void fallbackOnFailure() {
        PricingCatalog broken = mock(PricingCatalog.class);
        when(broken.pricingFor("ct")).thenThrow(new IllegalStateException("catalog unavailable"));

        PricingResult result = engine.price(List.of("ct", "pc"), 2, CallerContext.anonymous(), broken);

        assertThat(result.isFallbackApplied()).isTrue();
        assertThat(result.displaySubtotal()).isEqualTo("4.00");
        assertThat(result.displayFinalAmount()).isEqualTo("4.72");
        assertThat(result.getCurrency()).isEqualTo("INR");
    }
}
