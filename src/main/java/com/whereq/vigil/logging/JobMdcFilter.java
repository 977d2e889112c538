package com.whereq.vigil.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import com.whereq.vigil.job.RunContext;

/**
 * Lets through only events logged on behalf of one job.
 */
class JobMdcFilter extends Filter<ILoggingEvent> {

    private final String jobName;

    JobMdcFilter(String jobName) {
        this.jobName = jobName;
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        String job = event.getMDCPropertyMap().get(RunContext.MDC_JOB);
        return jobName.equals(job) ? FilterReply.NEUTRAL : FilterReply.DENY;
    }
}
