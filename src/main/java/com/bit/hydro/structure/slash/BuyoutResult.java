package com.bit.hydro.structure.slash;

import com.bit.hydro.structure.bank.BankSend;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BuyoutResult {
    private long lockId;
    /**
     * 0 表示待罚没已全部买断
     */
    private BigInteger remainingPendingSlash;
    private List<BankSend> bankMessages;
}
