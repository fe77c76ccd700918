package com.bit.unchained.custody.memory;

import com.bit.unchained.common.Address;
import com.bit.unchained.custody.NftCustodian;
import com.bit.unchained.custody.NftReceiver;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存NFT登记表：转移后同步回调接收方，回调抛出异常时恢复原持有人
 */
@Slf4j
public class MemoryNftRegistry implements NftCustodian {

    private final Address address;
    private final Map<Long, Address> owners = new ConcurrentHashMap<>();
    private final Map<Address, NftReceiver> receivers = new ConcurrentHashMap<>();

    public MemoryNftRegistry(Address address) {
        this.address = address;
    }

    @Override
    public Address address() {
        return address;
    }

    public void mint(Address owner, long id) {
        if (owners.putIfAbsent(id, owner) != null) {
            throw new IllegalStateException("NFT已存在: " + id);
        }
    }

    @Override
    public void registerReceiver(NftReceiver receiver) {
        receivers.put(receiver.receiverAddress(), receiver);
    }

    @Override
    public Address ownerOf(long id) {
        Address owner = owners.get(id);
        if (owner == null) {
            throw new IllegalStateException("NFT不存在: " + id);
        }
        return owner;
    }

    @Override
    public void transferNft(Address holder, Address recipient, long id) {
        Address owner = ownerOf(id);
        if (!owner.equals(holder)) {
            throw new IllegalStateException("NFT " + id + " 不属于 " + holder);
        }
        owners.put(id, recipient);
        NftReceiver receiver = receivers.get(recipient);
        if (receiver == null) {
            return;
        }
        try {
            receiver.onNftReceived(address, holder, id);
        } catch (RuntimeException e) {
            owners.put(id, holder);
            log.debug("NFT {} 接收回调失败，已恢复持有人 {}", id, holder);
            throw e;
        }
    }
}
