package org.dxworks.markframe.session;

@FunctionalInterface
public interface SourceViewListener {

    void onSourceViewChanged(boolean sourceView);
}
