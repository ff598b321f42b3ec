package tech.andrefsramos.offer_tracker.adapters.inbound.api;

import tech.andrefsramos.offer_tracker.core.domain.OfferChange;

public record PreviewResponseItem(
        String operator,
        String name,
        String validity,
        String details,
        String price,
        String category,
        String remark
) {
    static PreviewResponseItem from(OfferChange c) {
        return new PreviewResponseItem(
                c.offer().operator(),
                c.offer().name(),
                c.offer().validity(),
                c.offer().details(),
                c.offer().price(),
                c.change().category().name(),
                c.change().remark()
        );
    }
}
