package com.newsdigest.backend.cluster;

import com.newsdigest.backend.model.entity.NewsItem;
import java.util.List;
import lombok.Value;

/**
 * Items judged to report the same story. The first member is the seed and becomes the master.
 */
@Value
public class TitleCluster {
    List<NewsItem> members;

    public NewsItem getMaster() {
        return members.get(0);
    }

    public int size() {
        return members.size();
    }
}
