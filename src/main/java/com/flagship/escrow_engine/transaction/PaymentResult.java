package com.flagship.escrow_engine.transaction;

import com.flagship.escrow_engine.hold.Hold;
import lombok.Value;

@Value
public class PaymentResult {
    EscrowTransaction transaction;
    Hold hold;
}
