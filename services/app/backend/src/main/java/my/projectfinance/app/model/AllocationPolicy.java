package my.projectfinance.app.model;

public enum AllocationPolicy {
	PRO_RATA,
	WATERFALL
}
