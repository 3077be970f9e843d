package com.bit.hydro.ledger;

import com.bit.hydro.config.HydroConfig;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.tx.TxDataBase;
import com.bit.hydro.round.RoundClock;
import com.bit.hydro.service.GovernanceService;
import com.bit.hydro.store.ConstantsStore;
import com.bit.hydro.store.MetadataStore;
import com.bit.hydro.store.RoundHeightTracker;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.env.BlockEnv;
import com.bit.hydro.token.TokenManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 账本入口：同一时刻只有一笔交易在执行
 * 每笔交易写入独立的事务层，成功后一次性提交，任何异常都整体丢弃
 */
@Slf4j
@Component
public class HydroLedger {

    @Autowired
    private DataBase dataBase;

    @Autowired
    private ConstantsStore constantsStore;

    @Autowired
    private MetadataStore metadataStore;

    @Autowired
    private RoundHeightTracker roundHeightTracker;

    @Autowired
    private TokenManagerFactory tokenManagerFactory;

    @Autowired
    private GovernanceService governanceService;

    private final ReentrantLock txLock = new ReentrantLock();

    /**
     * 首次启动时写入初始配置，已初始化则跳过
     * @return 本次是否执行了初始化
     */
    public boolean initialize(HydroConfig config) {
        txLock.lock();
        TxDataBase tx = new TxDataBase(dataBase);
        try {
            if (metadataStore.isInitialized(tx)) {
                tx.rollback();
                return false;
            }
            governanceService.instantiate(tx, config);
            tx.commit();
            log.info("账本初始化完成, 第一轮开始时间: {}, 初始高度: {}", config.getFirstRoundStart(), config.getInitHeight());
            return true;
        } catch (RuntimeException e) {
            tx.rollback();
            log.error("账本初始化失败", e);
            throw e;
        } finally {
            txLock.unlock();
        }
    }

    public <T> T execute(BlockEnv env, LedgerAction<T> action) {
        txLock.lock();
        TxDataBase tx = new TxDataBase(dataBase);
        try {
            LedgerContext context = open(tx, env);
            roundHeightTracker.update(tx, context.getCurrentRound(), env.getHeight());
            T result = action.apply(context);
            int writes = tx.pendingWrites();
            tx.commit();
            log.debug("交易提交, height={}, sender={}, 写入数: {}", env.getHeight(), env.getSender(), writes);
            return result;
        } catch (RuntimeException e) {
            tx.rollback();
            log.warn("交易回滚, height={}, sender={}: {}", env.getHeight(), env.getSender(), e.getMessage());
            throw e;
        } finally {
            txLock.unlock();
        }
    }

    /**
     * 只读执行，写入一律丢弃
     */
    public <T> T query(BlockEnv env, LedgerAction<T> action) {
        TxDataBase tx = new TxDataBase(dataBase);
        try {
            return action.apply(open(tx, env));
        } finally {
            tx.rollback();
        }
    }

    private LedgerContext open(DataBase tx, BlockEnv env) {
        Constants constants = constantsStore.loadActiveAt(tx, env.getTimeNanos());
        long currentRound = RoundClock.computeRoundId(constants, env.getTimeNanos());
        return new LedgerContext(tx, env, constants, currentRound, tokenManagerFactory.create(tx));
    }
}
