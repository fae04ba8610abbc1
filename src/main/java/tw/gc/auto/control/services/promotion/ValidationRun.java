package tw.gc.auto.control.services.promotion;

/**
 * Raw metrics from an isolated validation run.
 *
 * @param drawdown peak-to-trough decline as a fraction
 */
public record ValidationRun(double pnl, double winRate, double drawdown) {
}
