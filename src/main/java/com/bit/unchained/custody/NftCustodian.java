package com.bit.unchained.custody;

import com.bit.unchained.common.Address;

/**
 * 非同质化资产登记表（外部托管方）
 * 接收方若登记为 NftReceiver，转移完成后同步回调其 onNftReceived，回调失败则整笔转移失败
 */
public interface NftCustodian {

    Address address();

    void transferNft(Address holder, Address recipient, long id);

    Address ownerOf(long id);

    void registerReceiver(NftReceiver receiver);
}
