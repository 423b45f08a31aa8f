package com.zzf.relay.progress;

import lombok.Value;

/**
 * Display text derived from one progress event. Replaces whatever update was pending before it.
 */
@Value
public class ProgressUpdate {
    ProgressEvent.Kind kind;
    String displayText;
}
