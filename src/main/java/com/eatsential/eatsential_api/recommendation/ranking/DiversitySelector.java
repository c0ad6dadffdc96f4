package com.eatsential.eatsential_api.recommendation.ranking;

import com.eatsential.eatsential_api.recommendation.model.Candidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * 식당당 최대 maxPerRestaurant 개까지만 담으면서 점수 순으로 limit 개를 고른다.
 *
 * <p>식당별 큐를 배열에 두고, 각 큐의 선두 점수를 키로 하는 우선순위 큐에서 매번 가장 높은 선두를 꺼낸다.
 * 꺼낸 식당은 상한에 닿지 않았고 남은 후보가 있으면 새 선두 점수로 다시 넣는다.
 * 동점은 입력 순서가 앞선 쪽이 먼저다. 후보가 모자라도 채워 넣지 않는다.
 */
@Component
public class DiversitySelector {

    public List<Candidate> select(List<Candidate> candidates, int limit, int maxPerRestaurant) {
        if (candidates == null || candidates.isEmpty() || limit <= 0 || maxPerRestaurant <= 0) {
            return List.of();
        }

        List<RestaurantQueue> queues = group(candidates);
        Comparator<Integer> byHead = (a, b) -> RANK.compare(queues.get(a).head(), queues.get(b).head());
        PriorityQueue<Integer> heads = new PriorityQueue<>(byHead);
        for (int i = 0; i < queues.size(); i++) {
            heads.add(i);
        }

        List<Candidate> selected = new ArrayList<>(Math.min(limit, candidates.size()));
        while (selected.size() < limit && !heads.isEmpty()) {
            int index = heads.poll();
            RestaurantQueue queue = queues.get(index);
            selected.add(queue.take().candidate());
            if (queue.taken() < maxPerRestaurant && queue.hasNext()) {
                heads.add(index);
            }
        }
        return selected;
    }

    private static final Comparator<Ranked> RANK = Comparator
            .comparingDouble((Ranked ranked) -> ranked.candidate().score()).reversed()
            .thenComparingInt(Ranked::position);

    private List<RestaurantQueue> group(List<Candidate> candidates) {
        List<RestaurantQueue> queues = new ArrayList<>();
        Map<Long, Integer> indexByRestaurant = new HashMap<>();
        for (int position = 0; position < candidates.size(); position++) {
            Candidate candidate = candidates.get(position);
            Long restaurantId = candidate.restaurantId();
            RestaurantQueue queue;
            if (restaurantId == null) {
                // 식당 정보가 없는 후보는 각자 독립 그룹
                queue = new RestaurantQueue();
                queues.add(queue);
            } else {
                Integer index = indexByRestaurant.get(restaurantId);
                if (index == null) {
                    index = queues.size();
                    indexByRestaurant.put(restaurantId, index);
                    queues.add(new RestaurantQueue());
                }
                queue = queues.get(index);
            }
            queue.add(new Ranked(candidate, position));
        }
        queues.forEach(RestaurantQueue::sort);
        return queues;
    }

    private record Ranked(Candidate candidate, int position) {
    }

    private static final class RestaurantQueue {
        private final List<Ranked> items = new ArrayList<>();
        private int cursor;

        void add(Ranked ranked) {
            items.add(ranked);
        }

        void sort() {
            items.sort(RANK);
        }

        Ranked head() {
            return items.get(cursor);
        }

        Ranked take() {
            return items.get(cursor++);
        }

        boolean hasNext() {
            return cursor < items.size();
        }

        int taken() {
            return cursor;
        }
    }
}
