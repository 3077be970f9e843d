package com.bit.hydro.structure.dto;

import com.bit.hydro.structure.env.BlockEnv;
import lombok.Data;

/**
 * 每个写请求都带区块高度、区块时间与调用方
 */
@Data
public class LedgerRequest {
    private long height;
    private long timeNanos;
    private String sender;

    public BlockEnv toEnv() {
        return new BlockEnv(height, timeNanos, sender);
    }
}
