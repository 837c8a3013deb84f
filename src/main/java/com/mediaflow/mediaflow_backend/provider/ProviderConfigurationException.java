package com.mediaflow.mediaflow_backend.provider;

import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobException;

/** No usable credential for a provider. Raised before any client is built. */
public class ProviderConfigurationException extends JobException {

    public ProviderConfigurationException(String message) {
        super(message);
    }

    @Override
    public JobErrorKind getKind() {
        return JobErrorKind.CONFIGURATION;
    }
}
