package com.quoteterm.event;

import com.quoteterm.domain.model.Position;
import java.util.List;
import org.springframework.context.ApplicationEvent;

public class PortfolioUpdatedEvent extends ApplicationEvent {

    private final List<Position> positions;

    public PortfolioUpdatedEvent(Object source, List<Position> positions) {
        super(source);
        this.positions = List.copyOf(positions);
    }

    public List<Position> getPositions() {
        return positions;
    }
}
