package com.hedgewise.backend.model;

public enum InstrumentType {
    FORWARD_CONTRACT,
    CURRENCY_OPTION,
    CURRENCY_SWAP
}
