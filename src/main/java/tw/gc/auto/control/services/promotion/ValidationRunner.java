package tw.gc.auto.control.services.promotion;

import tw.gc.auto.control.entities.StrategyCandidate;
import tw.gc.auto.control.exceptions.ValidationFailedException;

/**
 * Runs a candidate in an isolated validation environment.
 */
public interface ValidationRunner {

    /**
     * @param validationPeriodDays length of the evaluation window
     * @throws ValidationFailedException when the environment refuses the candidate outright
     */
    ValidationRun run(StrategyCandidate candidate, int validationPeriodDays);
}
