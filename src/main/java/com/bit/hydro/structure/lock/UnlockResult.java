package com.bit.hydro.structure.lock;

import com.bit.hydro.structure.bank.BankSend;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnlockResult {
    private List<Long> unlockedLockIds;
    private List<BankSend> bankMessages;
}
