package my.projectfinance.app.model;

public enum Currency {
	DOMESTIC,
	HARD_CURRENCY
}
