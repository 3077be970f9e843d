package com.bit.hydro.api;

import com.bit.hydro.ledger.HydroLedger;
import com.bit.hydro.result.Result;
import com.bit.hydro.service.LockService;
import com.bit.hydro.structure.dto.LockIdsRequest;
import com.bit.hydro.structure.dto.LockTokensRequest;
import com.bit.hydro.structure.dto.SplitLockRequest;
import com.bit.hydro.structure.env.BlockEnv;
import com.bit.hydro.structure.lock.LockComposition;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.lock.UnlockResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/lock")
public class LockApi {

    @Autowired
    private HydroLedger hydroLedger;

    @Autowired
    private LockService lockService;

    // 锁仓
    @PostMapping("/lockTokens")
    public Result<LockEntry> lockTokens(@RequestBody LockTokensRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(),
                context -> lockService.lockTokens(context, request.getFunds(), request.getLockDuration())));
    }

    // 拆分锁仓
    @PostMapping("/split")
    public Result<List<LockEntry>> split(@RequestBody SplitLockRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(),
                context -> lockService.splitLock(context, request.getLockId(), request.getAmount())));
    }

    // 合并锁仓
    @PostMapping("/merge")
    public Result<LockEntry> merge(@RequestBody LockIdsRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(),
                context -> lockService.mergeLocks(context, request.getLockIds())));
    }

    // 解锁到期锁仓
    @PostMapping("/unlock")
    public Result<UnlockResult> unlock(@RequestBody LockIdsRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(),
                context -> lockService.unlockTokens(context, request.getLockIds())));
    }

    @GetMapping("/detail")
    public Result<LockEntry> detail(@RequestParam long lockId, @RequestParam long height, @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> lockService.lock(context, lockId)));
    }

    @GetMapping("/userLocks")
    public Result<List<LockEntry>> userLocks(@RequestParam String address, @RequestParam long height,
                                             @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> lockService.userLocks(context, address)));
    }

    @GetMapping("/totalLocked")
    public Result<BigInteger> totalLocked(@RequestParam long height, @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null), lockService::totalLockedTokens));
    }

    // 锁仓经拆分/合并后当前由哪些锁仓承载
    @GetMapping("/composition")
    public Result<List<LockComposition>> composition(@RequestParam long lockId, @RequestParam long height,
                                                     @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> lockService.currentLockComposition(context, lockId)));
    }

    @GetMapping("/votingPower")
    public Result<BigInteger> votingPower(@RequestParam String address, @RequestParam long height,
                                          @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> lockService.userVotingPower(context, address)));
    }
}
