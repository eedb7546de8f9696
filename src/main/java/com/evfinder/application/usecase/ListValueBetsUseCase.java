package com.evfinder.application.usecase;

import com.evfinder.application.state.RefreshState;
import com.evfinder.domain.model.ValueBet;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Use case for reading the last detected value bets.
 */
@Service
public class ListValueBetsUseCase {

    private final RefreshState state;
    private final RefreshValueBetsUseCase refreshValueBets;

    public ListValueBetsUseCase(RefreshState state, RefreshValueBetsUseCase refreshValueBets) {
        this.state = state;
        this.refreshValueBets = refreshValueBets;
    }

    /**
     * Returns the filtered list and, when it is out of date, starts a background refresh.
     * The list returned is the one available now, not the one the refresh will produce.
     */
    public List<ValueBet> execute(ValueBetFilter filter) {
        refreshValueBets.refreshIfStale();
        return filter.apply(state.valueBets());
    }
}
