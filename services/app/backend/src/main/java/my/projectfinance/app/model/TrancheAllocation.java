package my.projectfinance.app.model;

import java.math.BigDecimal;

public record TrancheAllocation(String trancheId, int period, BigDecimal baseAmount, BigDecimal trancheAmount) {
}
