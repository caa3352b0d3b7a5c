package com.lineage.core.resume;

import java.util.Map;

/**
 * What a cold resume recovered from the shadow branch.
 *
 * @param headId               current tip of the shadow branch
 * @param anchorSyntheticId    nearest first-parent ancestor of the tip carrying an original-id tag
 * @param anchorOriginalId     the original commit that anchor was derived from
 * @param commitsBeyondAnchor  untagged commits between the tip and the anchor
 * @param originalToSynthetic  original id to synthetic id over the whole shadow history, tip-ward entries winning
 * @param effectiveTips        original id to the newest untagged descendant written on top of its synthetic
 *                             commit (a reconciliation), where one exists
 */
public record ShadowAnchor(
        String headId,
        String anchorSyntheticId,
        String anchorOriginalId,
        int commitsBeyondAnchor,
        Map<String, String> originalToSynthetic,
        Map<String, String> effectiveTips
) {

    /**
     * The synthetic commit that work following {@code originalId} chains onto.
     */
    public String tipFor(String originalId) {
        String tip = effectiveTips.get(originalId);
        return tip != null ? tip : originalToSynthetic.get(originalId);
    }
}
