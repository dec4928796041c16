package com.minireport.backend.pipeline;

/**
 * listPipelines 的过滤条件，字段为 null 表示不限。
 */
public final class PipelineFilter {

    private static final PipelineFilter ALL = new PipelineFilter(null, null);

    private final PipelineStatus status;
    private final String reportName;

    private PipelineFilter(PipelineStatus status, String reportName) {
        this.status = status;
        this.reportName = reportName;
    }

    public static PipelineFilter all() {
        return ALL;
    }

    public static PipelineFilter of(PipelineStatus status, String reportName) {
        return new PipelineFilter(status, reportName);
    }

    public static PipelineFilter byStatus(PipelineStatus status) {
        return new PipelineFilter(status, null);
    }

    public static PipelineFilter byReport(String reportName) {
        return new PipelineFilter(null, reportName);
    }

    public boolean matches(PipelineInfo info) {
        if(status != null && info.getStatus() != status) {
            return false;
        }
        return reportName == null || reportName.equals(info.getReportName());
    }

    public PipelineStatus getStatus() {
        return status;
    }

    public String getReportName() {
        return reportName;
    }
}
