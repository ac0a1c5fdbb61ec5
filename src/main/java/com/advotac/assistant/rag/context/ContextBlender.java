package com.advotac.assistant.rag.context;

import com.advotac.assistant.model.HitMetadata;
import com.advotac.assistant.model.Layer;
import com.advotac.assistant.model.LayeredContext;
import com.advotac.assistant.model.ScoredHit;
import com.advotac.assistant.rag.layer.LayerClassifier;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Chooses the final context set and serializes it.
 *
 * <p>{@link #select} takes a layer-weighted share of {@code topK} from the ranked hits, keeping
 * rank order inside each layer, and backfills any shortfall from the leftovers in L3, L2, L1
 * order. {@link #serialize} writes each selected hit as a {@code [[META]]}/{@code [[TEXT]]} block
 * into its layer bucket until the shared character budget would overflow; at that point no
 * further block is written for any layer.</p>
 */
@Component
public class ContextBlender {
    private static final Logger log = LoggerFactory.getLogger(ContextBlender.class);
    static final String BLOCK_SEPARATOR = "\n---\n";
    private static final List<Layer> BACKFILL_ORDER = List.of(Layer.L3, Layer.L2, Layer.L1);
    private final LayerClassifier layerClassifier;
    @Value("${advotac.context.max-chars:7500}")
    private int maxChars = 7500;
    @Value("${advotac.context.layer-weights.l1:0.15}")
    private double l1Weight = 0.15;
    @Value("${advotac.context.layer-weights.l2:0.55}")
    private double l2Weight = 0.55;
    @Value("${advotac.context.layer-weights.l3:0.30}")
    private double l3Weight = 0.30;

    public ContextBlender(LayerClassifier layerClassifier) {
        this.layerClassifier = layerClassifier;
    }

    @PostConstruct
    public void init() {
        if (this.l1Weight < 0.0 || this.l2Weight < 0.0 || this.l3Weight < 0.0) {
            throw new IllegalStateException("Layer weights must be non-negative");
        }
        log.info("Context blender initialized (maxChars={}, weights L1={} L2={} L3={})",
                this.maxChars, this.l1Weight, this.l2Weight, this.l3Weight);
    }

    /**
     * Per-layer targets for {@code topK}. L1 and L2 are rounded from their weights; L3 takes
     * the remainder, so the three always sum to {@code topK}.
     */
    public Map<Layer, Integer> layerTargets(int topK) {
        int total = Math.max(1, topK);
        int l1n = (int) Math.min(total, Math.max(0L, Math.round(total * this.l1Weight)));
        int l2n = (int) Math.min(total - l1n, Math.max(0L, Math.round(total * this.l2Weight)));
        int l3n = total - l1n - l2n;
        Map<Layer, Integer> targets = new EnumMap<>(Layer.class);
        targets.put(Layer.L1, l1n);
        targets.put(Layer.L2, l2n);
        targets.put(Layer.L3, l3n);
        return targets;
    }

    public List<ScoredHit> select(List<ScoredHit> ranked, int topK) {
        if (ranked == null || ranked.isEmpty()) {
            return List.of();
        }
        int total = Math.max(1, topK);
        Map<Layer, List<ScoredHit>> perLayer = new EnumMap<>(Layer.class);
        for (Layer layer : Layer.values()) {
            perLayer.put(layer, new ArrayList<>());
        }
        for (ScoredHit scored : ranked) {
            perLayer.get(this.layerClassifier.classify(scored.hit())).add(scored);
        }
        Map<Layer, Integer> targets = this.layerTargets(total);
        List<ScoredHit> blended = new ArrayList<>(Math.min(total, ranked.size()));
        for (Layer layer : BACKFILL_ORDER) {
            List<ScoredHit> bucket = perLayer.get(layer);
            blended.addAll(bucket.subList(0, Math.min(targets.get(layer), bucket.size())));
        }
        for (Layer layer : BACKFILL_ORDER) {
            if (blended.size() >= total) {
                break;
            }
            List<ScoredHit> bucket = perLayer.get(layer);
            for (int i = Math.min(targets.get(layer), bucket.size()); i < bucket.size() && blended.size() < total; i++) {
                blended.add(bucket.get(i));
            }
        }
        return blended.size() > total ? List.copyOf(blended.subList(0, total)) : List.copyOf(blended);
    }

    public LayeredContext serialize(List<ScoredHit> selected) {
        if (selected == null || selected.isEmpty()) {
            return LayeredContext.EMPTY;
        }
        Map<Layer, List<String>> buckets = new EnumMap<>(Layer.class);
        for (Layer layer : Layer.values()) {
            buckets.put(layer, new ArrayList<>());
        }
        int total = 0;
        int blocks = 0;
        for (ScoredHit scored : selected) {
            HitMetadata meta = scored.hit().metadata();
            String metaLine = metaLine(meta);
            String text = meta.textOrEmpty().trim();
            if (metaLine.isEmpty() && text.isEmpty()) {
                continue;
            }
            String block = "[[META]] " + metaLine + "\n[[TEXT]] " + text + "\n";
            if (total + block.length() > this.maxChars) {
                log.debug("Context budget of {} chars reached after {} blocks", this.maxChars, blocks);
                break;
            }
            buckets.get(this.layerClassifier.classify(scored.hit())).add(block);
            total += block.length();
            ++blocks;
        }
        return new LayeredContext(
                String.join(BLOCK_SEPARATOR, buckets.get(Layer.L1)),
                String.join(BLOCK_SEPARATOR, buckets.get(Layer.L2)),
                String.join(BLOCK_SEPARATOR, buckets.get(Layer.L3)),
                blocks, total);
    }

    public static String metaLine(HitMetadata meta) {
        String section = meta.sectionNumber() != null ? "Section " + meta.sectionNumber() : null;
        return Stream.of(meta.title(), section, meta.heading(), meta.breadcrumbs())
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(" | "));
    }
}
