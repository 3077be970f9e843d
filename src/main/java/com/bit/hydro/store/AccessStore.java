package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.exception.HydroException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 管理员与提案白名单
 */
@Component
public class AccessStore {

    private static final byte[] PRESENT = new byte[]{1};

    public void addAdmin(DataBase db, String address) {
        db.insert(TableEnum.WHITELIST_ADMINS, key(address), PRESENT);
    }

    public boolean isAdmin(DataBase db, String address) {
        return address != null && db.isExist(TableEnum.WHITELIST_ADMINS, key(address));
    }

    public void validateAdmin(DataBase db, String address) {
        if (!isAdmin(db, address)) {
            throw HydroException.unauthorized("Unauthorized: " + address + " is not a whitelist admin");
        }
    }

    public List<String> admins(DataBase db) {
        return addresses(db, TableEnum.WHITELIST_ADMINS);
    }

    public void addToWhitelist(DataBase db, String address) {
        db.insert(TableEnum.WHITELIST, key(address), PRESENT);
    }

    public void removeFromWhitelist(DataBase db, String address) {
        db.delete(TableEnum.WHITELIST, key(address));
    }

    public boolean isWhitelisted(DataBase db, String address) {
        return address != null && db.isExist(TableEnum.WHITELIST, key(address));
    }

    public List<String> whitelist(DataBase db) {
        return addresses(db, TableEnum.WHITELIST);
    }

    private List<String> addresses(DataBase db, TableEnum table) {
        List<String> result = new ArrayList<>();
        db.iterate(table, (key, value) -> result.add(new String(key, StandardCharsets.UTF_8)));
        return result;
    }

    private static byte[] key(String address) {
        return address.getBytes(StandardCharsets.UTF_8);
    }
}
