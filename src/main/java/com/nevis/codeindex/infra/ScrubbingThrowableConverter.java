package com.nevis.codeindex.infra;

import ch.qos.logback.classic.pattern.ExtendedThrowableProxyConverter;
import ch.qos.logback.classic.spi.IThrowableProxy;

public class ScrubbingThrowableConverter extends ExtendedThrowableProxyConverter {

    @Override
    protected String throwableProxyToString(IThrowableProxy throwableProxy) {
        return SecretScrubber.scrub(super.throwableProxyToString(throwableProxy));
    }
}
