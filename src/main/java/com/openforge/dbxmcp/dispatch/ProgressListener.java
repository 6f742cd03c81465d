package com.openforge.dbxmcp.dispatch;

/** Receives the progress events of one dispatched call, in order, on the worker thread. */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onProgress(ToolProgress progress);
}
