package com.bit.hydro.structure.power;

import com.bit.hydro.structure.lock.LockEntry;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 一次操作前后的锁仓状态，before 为 null 表示新建，after 为 null 表示移除
 */
@Data
@AllArgsConstructor
public class LockPowerChange {
    private LockEntry before;
    private LockEntry after;

    public static LockPowerChange created(LockEntry lock) {
        return new LockPowerChange(null, lock);
    }

    public static LockPowerChange removed(LockEntry lock) {
        return new LockPowerChange(lock, null);
    }
}
