package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.JsonUtil;
import org.springframework.stereotype.Component;

/**
 * 激活时间戳 -> Constants
 */
@Component
public class ConstantsStore {

    public void save(DataBase db, long activationTimestamp, Constants constants) {
        db.insert(TableEnum.CONSTANTS, ByteUtils.longToBytes(activationTimestamp), JsonUtil.toBytes(constants));
    }

    /**
     * 激活时间 <= timestamp 的最新一条
     */
    public Constants loadActiveAt(DataBase db, long timestamp) {
        DataBase.KeyValue<byte[]> entry = db.floorEntry(TableEnum.CONSTANTS,
                ByteUtils.longToBytes(0), ByteUtils.longToBytes(timestamp));
        if (entry == null) {
            throw HydroException.notFound("Failed to load constants active at the given timestamp.");
        }
        return JsonUtil.fromBytes(entry.getValue(), Constants.class);
    }
}
