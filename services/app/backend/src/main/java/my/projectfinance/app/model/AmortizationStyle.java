package my.projectfinance.app.model;

public enum AmortizationStyle {
	ANNUITY,
	SCULPTED
}
