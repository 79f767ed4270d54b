package com.sitely.ledger.sync;

public enum MirroredEntity {
    SITE,
    WORKER,
    WAGE_RECORD,
    EXPENSE_RECORD,
    PAYMENT_RECORD,
    MATERIAL,
    MATERIAL_USAGE,
    PHOTO
}
