package com.bit.hydro.service;

import com.bit.hydro.ledger.LedgerContext;
import com.bit.hydro.structure.lock.Coin;
import com.bit.hydro.structure.lock.LockComposition;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.lock.UnlockResult;

import java.math.BigInteger;
import java.util.List;

/**
 * 锁仓的创建、拆分、合并与解锁
 */
public interface LockService {

    LockEntry lockTokens(LedgerContext context, Coin funds, long lockDuration);

    /**
     * @return 两个新锁仓，先是剩余部分，再是拆出的部分
     */
    List<LockEntry> splitLock(LedgerContext context, long lockId, BigInteger amount);

    LockEntry mergeLocks(LedgerContext context, List<Long> lockIds);

    /**
     * lockIds 为空时解锁调用方所有到期的锁仓
     */
    UnlockResult unlockTokens(LedgerContext context, List<Long> lockIds);

    LockEntry lock(LedgerContext context, long lockId);

    List<LockEntry> userLocks(LedgerContext context, String address);

    BigInteger totalLockedTokens(LedgerContext context);

    List<LockComposition> currentLockComposition(LedgerContext context, long lockId);

    /**
     * 用户所有锁仓在当前轮结束时的投票权，按代币组比率折算成基础代币
     */
    BigInteger userVotingPower(LedgerContext context, String address);
}
