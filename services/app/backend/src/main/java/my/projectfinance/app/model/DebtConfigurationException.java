package my.projectfinance.app.model;

public class DebtConfigurationException extends RuntimeException {
	private final String trancheId;
	private final Integer period;

	public DebtConfigurationException(String message) {
		this(message, null, null);
	}

	public DebtConfigurationException(String message, String trancheId) {
		this(message, trancheId, null);
	}

	public DebtConfigurationException(String message, String trancheId, Integer period) {
		super(message);
		this.trancheId = trancheId;
		this.period = period;
	}

	public String getTrancheId() {
		return trancheId;
	}

	public Integer getPeriod() {
		return period;
	}
}
