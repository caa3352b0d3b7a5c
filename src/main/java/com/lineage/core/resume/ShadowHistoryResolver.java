package com.lineage.core.resume;

import com.lineage.core.git.CommitMetadata;
import com.lineage.core.git.GitHistoryReader;
import com.lineage.core.git.GitHistoryReader.LoggedCommit;
import com.lineage.core.git.ShadowRefs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recovers resume information from the shadow branch alone, for runs without a state file.
 */
public class ShadowHistoryResolver {

    private static final Logger log = LoggerFactory.getLogger(ShadowHistoryResolver.class);

    static final int WALK_LIMIT = 100;

    private final GitHistoryReader reader;

    public ShadowHistoryResolver(GitHistoryReader reader) {
        this.reader = reader;
    }

    /**
     * @return empty if the shadow branch does not exist
     * @throws IllegalStateException if none of the last {@value #WALK_LIMIT} first-parent commits is tagged
     */
    public Optional<ShadowAnchor> resolve(String shadowBranch) {
        ShadowRefs.validateBranchName(shadowBranch);
        Optional<String> head = reader.resolveCommit("refs/heads/" + shadowBranch);
        if (head.isEmpty()) {
            log.debug("Shadow branch {} does not exist", shadowBranch);
            return Optional.empty();
        }
        String headId = head.get();

        List<LoggedCommit> recent = reader.readMessages(headId, true, WALK_LIMIT);
        String anchorSynthetic = null;
        String anchorOriginal = null;
        int beyond = 0;
        for (LoggedCommit commit : recent) {
            Optional<String> original = CommitMetadata.parseOriginalId(commit.message());
            if (original.isPresent()) {
                anchorSynthetic = commit.id();
                anchorOriginal = original.get();
                break;
            }
            beyond++;
        }
        if (anchorOriginal == null) {
            throw new IllegalStateException("No " + CommitMetadata.ORIGINAL_PREFIX.strip()
                    + " tag found in the last " + WALK_LIMIT + " commits of " + shadowBranch
                    + ". The branch was not produced by this tool or is corrupt.");
        }
        if (beyond > 0) {
            log.info("Shadow branch {} has {} untagged commit(s) above anchor {}",
                    shadowBranch, beyond, CommitMetadata.shortId(anchorSynthetic));
        }

        List<LoggedCommit> all = reader.readMessages(headId, false, 0);
        var idMap = new LinkedHashMap<String, String>();
        var tagged = new HashMap<String, String>();
        var firstParents = new HashMap<String, String>();
        for (LoggedCommit commit : all) {
            if (!commit.parentIds().isEmpty()) {
                firstParents.put(commit.id(), commit.parentIds().get(0));
            }
            CommitMetadata.parseOriginalId(commit.message()).ifPresent(original -> {
                tagged.put(commit.id(), original);
                idMap.putIfAbsent(original, commit.id());
            });
        }

        var effectiveTips = new HashMap<String, String>();
        for (LoggedCommit commit : all) {
            if (tagged.containsKey(commit.id())) {
                continue;
            }
            String cursor = firstParents.get(commit.id());
            while (cursor != null && !tagged.containsKey(cursor)) {
                cursor = firstParents.get(cursor);
            }
            if (cursor != null) {
                effectiveTips.putIfAbsent(tagged.get(cursor), commit.id());
            }
        }

        log.info("Shadow branch {} anchors at {} (original {}), {} mapped commits",
                shadowBranch, CommitMetadata.shortId(anchorSynthetic),
                CommitMetadata.shortId(anchorOriginal), idMap.size());
        return Optional.of(new ShadowAnchor(headId, anchorSynthetic, anchorOriginal, beyond,
                Collections.unmodifiableMap(idMap), Collections.unmodifiableMap(effectiveTips)));
    }
}
