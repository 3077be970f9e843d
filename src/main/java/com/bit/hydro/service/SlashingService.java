package com.bit.hydro.service;

import com.bit.hydro.common.Fraction;
import com.bit.hydro.ledger.LedgerContext;
import com.bit.hydro.structure.lock.Coin;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.slash.AmountToSlash;
import com.bit.hydro.structure.slash.BuyoutResult;
import com.bit.hydro.structure.slash.SlashProposalVotersResult;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * 对投票给某提案的锁仓执行罚没，以及待罚没的买断
 */
public interface SlashingService {

    /**
     * 按 lockId 升序分页处理 (round, tranche) 中投给该提案的锁仓
     * 累计待罚没达到阈值才扣减锁仓，否则只记录待罚没
     */
    SlashProposalVotersResult slashProposalVoters(LedgerContext context, long roundId, long trancheId,
                                                  long proposalId, BigDecimal slashPercent, long startFrom, long limit);

    /**
     * 按 100% 比例模拟罚没，返回折算成基础代币的总量，不修改任何状态
     */
    BigInteger slashableTokenNumForProposal(LedgerContext context, long roundId, long trancheId, long proposalId);

    BuyoutResult buyoutPendingSlash(LedgerContext context, long lockId, List<Coin> funds);

    BigInteger pendingSlash(LedgerContext context, long lockId);

    /**
     * 投票时的锁仓中有 fraction 份额落在 lockToSlash 上，计算应罚没的数量（lockToSlash 的币种）
     * 任一比率为 0 时返回 0，结果不超过 lockToSlash 当前数量
     */
    AmountToSlash intoAmountToSlash(LedgerContext context, LockEntry votedLock, LockEntry lockToSlash,
                                    Fraction fraction, BigDecimal slashPercent, long votingRound);
}
