package my.projectfinance.app.model;

public enum CovenantSeverity {
	OK,
	WARNING,
	BREACH,
	CRITICAL
}
