package tw.gc.auto.control.services.promotion;

import tw.gc.auto.control.entities.CapitalAllocation;
import tw.gc.auto.control.entities.StrategyCandidate;

/**
 * Hands a promoted strategy to the execution system.
 */
public interface StrategyRegistrar {

    void register(StrategyCandidate candidate, CapitalAllocation allocation);
}
