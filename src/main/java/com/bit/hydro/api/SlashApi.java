package com.bit.hydro.api;

import com.bit.hydro.ledger.HydroLedger;
import com.bit.hydro.result.Result;
import com.bit.hydro.service.SlashingService;
import com.bit.hydro.structure.dto.BuyoutRequest;
import com.bit.hydro.structure.dto.SlashProposalVotersRequest;
import com.bit.hydro.structure.env.BlockEnv;
import com.bit.hydro.structure.slash.BuyoutResult;
import com.bit.hydro.structure.slash.SlashProposalVotersResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

@Slf4j
@RestController
@RequestMapping("/slash")
public class SlashApi {

    @Autowired
    private HydroLedger hydroLedger;

    @Autowired
    private SlashingService slashingService;

    // 罚没投票给提案的锁仓（管理员，分页）
    @PostMapping("/proposalVoters")
    public Result<SlashProposalVotersResult> slashProposalVoters(@RequestBody SlashProposalVotersRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(), context -> slashingService.slashProposalVoters(context,
                request.getRoundId(), request.getTrancheId(), request.getProposalId(), request.getSlashPercent(),
                request.getStartFrom(), request.getLimit())));
    }

    // 提案投票者可被罚没的基础代币总量
    @GetMapping("/slashable")
    public Result<BigInteger> slashable(@RequestParam long roundId, @RequestParam long trancheId,
                                        @RequestParam long proposalId, @RequestParam long height,
                                        @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> slashingService.slashableTokenNumForProposal(context, roundId, trancheId, proposalId)));
    }

    @PostMapping("/buyout")
    public Result<BuyoutResult> buyout(@RequestBody BuyoutRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(),
                context -> slashingService.buyoutPendingSlash(context, request.getLockId(), request.getFunds())));
    }

    @GetMapping("/pending")
    public Result<BigInteger> pending(@RequestParam long lockId, @RequestParam long height,
                                      @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> slashingService.pendingSlash(context, lockId)));
    }
}
