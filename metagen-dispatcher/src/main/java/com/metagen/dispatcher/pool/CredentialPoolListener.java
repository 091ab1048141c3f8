package com.metagen.dispatcher.pool;

import com.metagen.common.dto.CredentialStats;

/**
 * 凭证池变更回调，宿主应用借此持久化凭证的有效性与用量。
 * <p>
 * 回调在池锁之外、由触发变更的线程执行，实现不应长时间阻塞。
 */
public interface CredentialPoolListener {

    /** 凭证的状态或用量发生变化（包括新增） */
    default void onCredentialStateChanged(CredentialStats credential) {
    }

    /** 凭证已从池中移除 */
    default void onCredentialRemoved(String credentialId) {
    }
}
