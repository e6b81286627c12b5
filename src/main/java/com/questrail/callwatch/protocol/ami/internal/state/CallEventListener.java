package com.questrail.callwatch.protocol.ami.internal.state;

import com.questrail.callwatch.api.Call;

/**
 * Receives lifecycle transitions from {@link CallStateTracker}, in order per call.
 */
public interface CallEventListener
{
    void onCallStarted(Call call);

    void onCallAnswered(Call call);

    void onCallEnded(Call call);
}
