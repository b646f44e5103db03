package com.newsdigest.backend.cluster;

import com.newsdigest.backend.model.entity.NewsItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Greedy seed clustering by title similarity. Each unassigned item, in order, seeds a cluster and
 * takes every later unassigned item whose similarity to the seed is strictly above the threshold.
 * Similarity is measured against the seed only, so grouping is not transitive.
 */
@Component
public class TitleClusterer {

    private final TfIdfVectorizer vectorizer = new TfIdfVectorizer();

    public List<TitleCluster> cluster(List<NewsItem> items, double threshold) {
        List<TitleCluster> clusters = new ArrayList<>();
        if (items.size() < 2) {
            items.forEach(item -> clusters.add(new TitleCluster(List.of(item))));
            return clusters;
        }

        List<String> titles = items.stream().map(NewsItem::getTitle).toList();
        List<Map<String, Double>> vectors = vectorizer.fitTransform(titles);
        boolean[] assigned = new boolean[items.size()];

        for (int seed = 0; seed < items.size(); seed++) {
            if (assigned[seed]) {
                continue;
            }
            assigned[seed] = true;
            List<NewsItem> members = new ArrayList<>();
            members.add(items.get(seed));
            for (int other = seed + 1; other < items.size(); other++) {
                if (!assigned[other] && TfIdfVectorizer.cosine(vectors.get(seed), vectors.get(other)) > threshold) {
                    assigned[other] = true;
                    members.add(items.get(other));
                }
            }
            clusters.add(new TitleCluster(members));
        }
        return clusters;
    }
}
