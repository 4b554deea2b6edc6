package my.projectfinance.app.model;

public enum CovenantMetric {
	DSCR,
	LLCR,
	PLCR
}
