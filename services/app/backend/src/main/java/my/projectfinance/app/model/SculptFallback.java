package my.projectfinance.app.model;

public enum SculptFallback {
	NONE,
	ANNUITY
}
