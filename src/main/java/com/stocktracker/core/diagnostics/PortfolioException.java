package com.stocktracker.core.diagnostics;

/**
 * Recoverable rejection of an engine operation. Carries the cause code plus the ticker and
 * cycle id needed to audit why a position did not transition.
 */
public class PortfolioException extends RuntimeException {
    private final CauseCode causeCode;
    private final String ticker;
    private final String cycleId;

    public PortfolioException(CauseCode causeCode, String ticker, String cycleId, String message) {
        super(message);
        this.causeCode = causeCode == null ? CauseCode.RUNTIME_ERROR : causeCode;
        this.ticker = ticker == null ? "" : ticker;
        this.cycleId = cycleId == null ? "" : cycleId;
    }

    public PortfolioException(CauseCode causeCode, String ticker, String cycleId, String message, Throwable cause) {
        super(message, cause);
        this.causeCode = causeCode == null ? CauseCode.RUNTIME_ERROR : causeCode;
        this.ticker = ticker == null ? "" : ticker;
        this.cycleId = cycleId == null ? "" : cycleId;
    }

    public static PortfolioException of(CauseCode causeCode, String ticker, String message) {
        return new PortfolioException(causeCode, ticker, "", message);
    }

    public CauseCode causeCode() {
        return causeCode;
    }

    public String ticker() {
        return ticker;
    }

    public String cycleId() {
        return cycleId;
    }

    /**
     * Same rejection tagged with the cycle it happened in.
     */
    public PortfolioException inCycle(String cycleId) {
        if (cycleId == null || cycleId.equals(this.cycleId)) {
            return this;
        }
        return new PortfolioException(causeCode, ticker, cycleId, getMessage(), getCause());
    }

    @Override
    public String toString() {
        return "PortfolioException{cause=" + causeCode + ", ticker=" + ticker + ", cycle=" + cycleId + ", msg=" + getMessage() + "}";
    }
}
