package com.bit.hydro.structure.env;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 调用方提供的区块环境，账本本身从不读取系统时钟
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlockEnv {
    private long height;
    /**
     * 区块时间（纳秒）
     */
    private long timeNanos;
    private String sender;

    public BlockEnv withSender(String sender) {
        return new BlockEnv(height, timeNanos, sender);
    }
}
