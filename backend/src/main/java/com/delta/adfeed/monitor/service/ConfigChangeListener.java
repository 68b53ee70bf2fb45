package com.delta.adfeed.monitor.service;

import com.delta.adfeed.monitor.model.ConfigSnapshot;

/**
 * Notified after a new snapshot becomes live. Throwing makes the config service roll the update back,
 * after which listeners are called again with the arguments swapped.
 */
public interface ConfigChangeListener {
    void onConfigApplied(ConfigSnapshot previous, ConfigSnapshot current);
}
