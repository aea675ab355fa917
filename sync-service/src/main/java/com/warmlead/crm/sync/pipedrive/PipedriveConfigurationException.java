package com.warmlead.crm.sync.pipedrive;

import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.error.SyncException;

/**
 * No usable Pipedrive API key is configured for a user.
 */
public class PipedriveConfigurationException extends SyncException {

    public PipedriveConfigurationException(String message) {
        super(ErrorKind.AUTHENTICATION, message);
    }
}
