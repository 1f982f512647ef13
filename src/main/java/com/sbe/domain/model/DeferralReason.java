package com.sbe.domain.model;

/**
 * Why a transaction could not be placed in a batch during a chunk cycle
 */
public enum DeferralReason {
    /** The window-level liquidity cap for the currency would be exceeded. */
    LIQUIDITY_BREACH,
    /** The transaction alone exceeds its counterparty's exposure cap. */
    EXPOSURE_CAP_EXCEEDED
}
