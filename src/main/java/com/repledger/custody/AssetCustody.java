package com.repledger.custody;

import java.math.BigInteger;

/**
 * Fungible-asset balances the ledger moves funds through.
 *
 * <p>Implementations must be fee-less and non-rebasing: crediting {@code n} units must raise the
 * balance by exactly {@code n}. The ledger's collateral accounting is wrong otherwise.
 */
public interface AssetCustody {

    /** Removes {@code amount} of {@code asset} from {@code owner}; fails if the balance is short. */
    void debit(String asset, String owner, BigInteger amount);

    void credit(String asset, String owner, BigInteger amount);

    BigInteger balanceOf(String asset, String owner);
}
