package com.bit.unchained.custody;

import com.bit.unchained.common.Address;

public interface NftReceiver {

    Address receiverAddress();

    /**
     * @param registry 发起回调的登记表地址
     * @param from     原持有人
     */
    void onNftReceived(Address registry, Address from, long id);
}
