package my.projectfinance.app.model;

public enum ValidationPolicy {
	STRICT,
	PERMISSIVE
}
