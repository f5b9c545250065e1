package com.wpanther.greengoods.repository;

import com.wpanther.greengoods.entity.Platform;

/**
 * Closed projection of a user account to its platform identity; key material is never selected.
 */
public interface PlatformIdentity {

    Platform getPlatform();

    String getPlatformId();
}
