package com.bit.hydro.structure.bank;

import com.bit.hydro.structure.lock.Coin;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 账本发出的转账指令，由外部执行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BankSend {
    private String toAddress;
    private List<Coin> amount;
}
