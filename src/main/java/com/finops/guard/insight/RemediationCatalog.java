package com.finops.guard.insight;

import com.finops.guard.model.ImpactLevel;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Static hypothesis and remediation text per cloud service family.
 * Entries are matched by substring on the lower-cased service name; first match wins.
 */
@Component
public class RemediationCatalog {

    private static final List<Entry> ENTRIES = List.of(
            new Entry(List.of("ec2", "compute"),
                    "Sustained EC2 growth likely due to oversized instances in a non-optimized autoscaling group.",
                    "Rightsize EC2 instances and enforce scale-in policy",
                    0.35, ImpactLevel.MEDIUM, ImpactLevel.LOW),
            new Entry(List.of("s3", "storage"),
                    "Storage growth from objects accumulating without lifecycle transitions or expiry.",
                    "Add S3 lifecycle rules to tier or expire cold objects",
                    0.40, ImpactLevel.LOW, ImpactLevel.LOW),
            new Entry(List.of("rds", "database", "aurora"),
                    "Database spend rose with provisioned capacity or IOPS beyond the observed workload.",
                    "Downsize RDS instance class and review provisioned IOPS",
                    0.25, ImpactLevel.MEDIUM, ImpactLevel.MEDIUM),
            new Entry(List.of("lambda"),
                    "Invocation volume or duration increased, possibly from a retry loop or memory over-allocation.",
                    "Tune Lambda memory size and check for runaway retries",
                    0.30, ImpactLevel.LOW, ImpactLevel.LOW),
            new Entry(List.of("transfer", "cloudfront", "nat"),
                    "Data transfer charges jumped, typically cross-AZ traffic or NAT gateway egress.",
                    "Route traffic through VPC endpoints and keep chatty services in one AZ",
                    0.20, ImpactLevel.HIGH, ImpactLevel.MEDIUM)
    );

    private static final Entry FALLBACK = new Entry(List.of(),
            "Cost rose sharply above its recent baseline; usage or pricing changed for this service.",
            "Review recent usage changes and tag ownership for this service",
            0.10, ImpactLevel.MEDIUM, ImpactLevel.LOW);

    public Entry lookup(String service) {
        String normalized = service == null ? "" : service.toLowerCase(Locale.ROOT);
        for (Entry entry : ENTRIES) {
            for (String keyword : entry.keywords()) {
                if (normalized.contains(keyword)) {
                    return entry;
                }
            }
        }
        return FALLBACK;
    }

    /**
     * @param recoverableFraction share of the daily excess that the action is expected to remove
     */
    public record Entry(List<String> keywords,
                        String hypothesis,
                        String action,
                        double recoverableFraction,
                        ImpactLevel effort,
                        ImpactLevel risk) {}
}
