package com.bit.hydro.api;

import com.bit.hydro.ledger.HydroLedger;
import com.bit.hydro.result.Result;
import com.bit.hydro.service.GovernanceService;
import com.bit.hydro.service.TokenRatioService;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.dto.AddTrancheRequest;
import com.bit.hydro.structure.dto.AddressRequest;
import com.bit.hydro.structure.dto.CreateProposalRequest;
import com.bit.hydro.structure.dto.LedgerRequest;
import com.bit.hydro.structure.dto.UpdateConstantsRequest;
import com.bit.hydro.structure.dto.UpdateTokenRatioRequest;
import com.bit.hydro.structure.env.BlockEnv;
import com.bit.hydro.structure.proposal.Proposal;
import com.bit.hydro.structure.proposal.Tranche;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/governance")
public class GovernanceApi {

    @Autowired
    private HydroLedger hydroLedger;

    @Autowired
    private GovernanceService governanceService;

    @Autowired
    private TokenRatioService tokenRatioService;

    @PostMapping("/updateConstants")
    public Result<Void> updateConstants(@RequestBody UpdateConstantsRequest request) {
        hydroLedger.execute(request.toEnv(), context -> {
            governanceService.updateConstants(context, request.getActivationTimestamp(), request.getConstants());
            return null;
        });
        return Result.ok();
    }

    @PostMapping("/pause")
    public Result<Void> pause(@RequestBody LedgerRequest request) {
        hydroLedger.execute(request.toEnv(), context -> {
            governanceService.pause(context);
            return null;
        });
        return Result.ok();
    }

    @PostMapping("/whitelist/add")
    public Result<Void> addToWhitelist(@RequestBody AddressRequest request) {
        hydroLedger.execute(request.toEnv(), context -> {
            governanceService.addToWhitelist(context, request.getAddress());
            return null;
        });
        return Result.ok();
    }

    @PostMapping("/whitelist/remove")
    public Result<Void> removeFromWhitelist(@RequestBody AddressRequest request) {
        hydroLedger.execute(request.toEnv(), context -> {
            governanceService.removeFromWhitelist(context, request.getAddress());
            return null;
        });
        return Result.ok();
    }

    @PostMapping("/tranche/add")
    public Result<Tranche> addTranche(@RequestBody AddTrancheRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(),
                context -> governanceService.addTranche(context, request.getName(), request.getMetadata())));
    }

    @PostMapping("/proposal/create")
    public Result<Proposal> createProposal(@RequestBody CreateProposalRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(), context -> governanceService.createProposal(context,
                request.getTrancheId(), request.getTitle(), request.getDescription(),
                request.getDeploymentDuration())));
    }

    // 更新代币组比率（管理员）
    @PostMapping("/tokenRatio/update")
    public Result<Void> updateTokenRatio(@RequestBody UpdateTokenRatioRequest request) {
        hydroLedger.execute(request.toEnv(), context -> {
            tokenRatioService.updateTokenGroupRatio(context, request.getTokenGroupId(), request.getRatio());
            return null;
        });
        return Result.ok();
    }

    @GetMapping("/constants")
    public Result<Constants> constants(@RequestParam long height, @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null), context -> context.getConstants()));
    }

    @GetMapping("/currentRound")
    public Result<Long> currentRound(@RequestParam long height, @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null), context -> context.getCurrentRound()));
    }

    @GetMapping("/tranches")
    public Result<List<Tranche>> tranches(@RequestParam long height, @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null), governanceService::tranches));
    }

    @GetMapping("/whitelist")
    public Result<List<String>> whitelist(@RequestParam long height, @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null), governanceService::whitelist));
    }

    @GetMapping("/whitelistAdmins")
    public Result<List<String>> whitelistAdmins(@RequestParam long height, @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null), governanceService::whitelistAdmins));
    }

    @GetMapping("/proposal")
    public Result<Proposal> proposal(@RequestParam long roundId, @RequestParam long trancheId,
                                     @RequestParam long proposalId, @RequestParam long height,
                                     @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> governanceService.proposal(context, roundId, trancheId, proposalId)));
    }

    @GetMapping("/proposals")
    public Result<List<Proposal>> proposals(@RequestParam long roundId, @RequestParam long trancheId,
                                            @RequestParam long height, @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> governanceService.roundProposals(context, roundId, trancheId)));
    }

    // atHeight 为空时返回最新值
    @GetMapping("/roundTotalPower")
    public Result<BigInteger> roundTotalPower(@RequestParam long roundId,
                                              @RequestParam(required = false) Long atHeight,
                                              @RequestParam long height, @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null), context -> atHeight == null
                ? governanceService.roundTotalPower(context, roundId)
                : governanceService.roundTotalPowerAtHeight(context, roundId, atHeight)));
    }

    @GetMapping("/tokenRatios")
    public Result<Map<String, BigDecimal>> tokenRatios(@RequestParam long roundId, @RequestParam long height,
                                                       @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> tokenRatioService.allTokenGroupRatios(context, roundId)));
    }
}
