package com.spendguard.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Cost per unit of usage for one (provider, model) pair.
 * Token units use {@code inputRate} and {@code outputRate}; every other unit
 * uses {@code flatRate}. Consistency is checked by
 * {@link com.spendguard.core.pricing.PricingValidator}, not here, so that a
 * misconfigured row can still be loaded and then rejected.
 */
public class PriceEntry {

    private final String provider;
    private final String model;
    private final PricingUnit unit;
    private final BigDecimal inputRate;
    private final BigDecimal outputRate;
    private final BigDecimal flatRate;
    private final String currency;
    private final BillingModel billingModel;
    private final LocalDate effectiveDate;
    private final PriceSource source;

    private PriceEntry(Builder builder) {
        this.provider = builder.provider;
        this.model = builder.model;
        this.unit = builder.unit;
        this.inputRate = builder.inputRate;
        this.outputRate = builder.outputRate;
        this.flatRate = builder.flatRate;
        this.currency = builder.currency != null ? builder.currency : "USD";
        this.billingModel = builder.billingModel != null ? builder.billingModel : BillingModel.PAY_PER_USE;
        this.effectiveDate = builder.effectiveDate;
        this.source = builder.source;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public PricingUnit getUnit() {
        return unit;
    }

    public BigDecimal getInputRate() {
        return inputRate;
    }

    public BigDecimal getOutputRate() {
        return outputRate;
    }

    public BigDecimal getFlatRate() {
        return flatRate;
    }

    public String getCurrency() {
        return currency;
    }

    public BillingModel getBillingModel() {
        return billingModel;
    }

    public LocalDate getEffectiveDate() {
        return effectiveDate;
    }

    public PriceSource getSource() {
        return source;
    }

    /**
     * Creates a copy of this entry tagged with the tier that answered.
     */
    public PriceEntry withSource(PriceSource source) {
        return toBuilder().source(source).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .provider(provider)
                .model(model)
                .unit(unit)
                .inputRate(inputRate)
                .outputRate(outputRate)
                .flatRate(flatRate)
                .currency(currency)
                .billingModel(billingModel)
                .effectiveDate(effectiveDate)
                .source(source);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for a split token rate. */
    public static PriceEntry tokenRate(String provider, String model, PricingUnit unit,
            String inputRate, String outputRate) {
        return builder()
                .provider(provider)
                .model(model)
                .unit(unit)
                .inputRate(new BigDecimal(inputRate))
                .outputRate(new BigDecimal(outputRate))
                .build();
    }

    /** Shorthand for a flat (count, time or data) rate. */
    public static PriceEntry flatRate(String provider, String model, PricingUnit unit, String flatRate) {
        return builder()
                .provider(provider)
                .model(model)
                .unit(unit)
                .flatRate(new BigDecimal(flatRate))
                .build();
    }

    public static class Builder {
        private String provider;
        private String model;
        private PricingUnit unit;
        private BigDecimal inputRate;
        private BigDecimal outputRate;
        private BigDecimal flatRate;
        private String currency;
        private BillingModel billingModel;
        private LocalDate effectiveDate;
        private PriceSource source;

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder unit(PricingUnit unit) {
            this.unit = unit;
            return this;
        }

        public Builder inputRate(BigDecimal inputRate) {
            this.inputRate = inputRate;
            return this;
        }

        public Builder outputRate(BigDecimal outputRate) {
            this.outputRate = outputRate;
            return this;
        }

        public Builder flatRate(BigDecimal flatRate) {
            this.flatRate = flatRate;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder billingModel(BillingModel billingModel) {
            this.billingModel = billingModel;
            return this;
        }

        public Builder effectiveDate(LocalDate effectiveDate) {
            this.effectiveDate = effectiveDate;
            return this;
        }

        public Builder source(PriceSource source) {
            this.source = source;
            return this;
        }

        public PriceEntry build() {
            return new PriceEntry(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PriceEntry))
            return false;
        PriceEntry that = (PriceEntry) o;
        return Objects.equals(provider, that.provider)
                && Objects.equals(model, that.model)
                && unit == that.unit
                && Objects.equals(inputRate, that.inputRate)
                && Objects.equals(outputRate, that.outputRate)
                && Objects.equals(flatRate, that.flatRate)
                && Objects.equals(currency, that.currency)
                && billingModel == that.billingModel
                && Objects.equals(effectiveDate, that.effectiveDate)
                && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, model, unit, inputRate, outputRate, flatRate,
                currency, billingModel, effectiveDate, source);
    }

    @Override
    public String toString() {
        return "PriceEntry{" +
                "provider='" + provider + '\'' +
                ", model='" + model + '\'' +
                ", unit=" + unit +
                ", input=" + inputRate +
                ", output=" + outputRate +
                ", flat=" + flatRate +
                ", source=" + source +
                '}';
    }
}
