package com.flagship.escrow_engine.transaction;

/**
 * Which side of a sale a listing query matches on.
 */
public enum PartyRole {
    BUYER,
    SELLER,
    ANY
}
