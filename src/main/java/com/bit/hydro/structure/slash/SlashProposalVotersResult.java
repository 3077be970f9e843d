package com.bit.hydro.structure.slash;

import com.bit.hydro.structure.bank.BankSend;
import com.bit.hydro.structure.lock.Coin;
import lombok.Data;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

@Data
public class SlashProposalVotersResult {
    private List<SlashedLockup> slashedLockups = new ArrayList<>();
    private List<Long> skippedLockups = new ArrayList<>();
    private List<Long> pendingSlashesAdded = new ArrayList<>();
    /**
     * 按币种汇总的罚没数量
     */
    private List<Coin> slashedAmounts = new ArrayList<>();
    /**
     * 折算成基础代币的罚没总量
     */
    private BigInteger totalTokensSlashed = BigInteger.ZERO;
    private List<BankSend> bankMessages = new ArrayList<>();
}
