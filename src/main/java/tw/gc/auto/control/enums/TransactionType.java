package tw.gc.auto.control.enums;

public enum TransactionType {
    POOL_INIT,
    ALLOCATION,
    RELEASE,
    PNL_UPDATE,
    TRANSFER_OUT,
    TRANSFER_IN
}
