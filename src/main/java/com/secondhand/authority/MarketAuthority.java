package com.secondhand.authority;

import com.google.inject.Guice;
import com.secondhand.config.MarketConfig;
import com.secondhand.core.MarketModule;
import com.secondhand.core.MarketSession;
import com.secondhand.error.OperationResult;
import com.secondhand.host.HostServices;
import com.secondhand.negotiation.NegotiationOutcome;
import com.secondhand.state.SaleView;
import com.secondhand.state.SearchView;
import com.secondhand.util.Randomization;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Applies participant requests against the authoritative session.
 *
 * <p>Requests queue in arrival order and are applied one at a time when the host drains
 * them, each re-validated against the state the previous ones left. Of two requests racing
 * for the same listing the first wins and the second gets the session's "already" error.
 * Every successful request is broadcast as a {@link StateChange}.
 */
@Slf4j
@Singleton
public class MarketAuthority {

    private final MarketSession session;
    private final StateBroadcaster broadcaster;

    private final Deque<MarketRequest> pending = new ArrayDeque<>();

    private long sequence;

    @Inject
    public MarketAuthority(MarketSession session, StateBroadcaster broadcaster) {
        this.session = session;
        this.broadcaster = broadcaster;
    }

    /**
     * Open a session and the authority in front of it. Broadcasts go to the host's
     * {@link HostServices#getBroadcaster()}.
     */
    public static MarketAuthority open(HostServices host, MarketConfig config, Randomization randomization) {
        return Guice.createInjector(new MarketModule(host, config, randomization))
                .getInstance(MarketAuthority.class);
    }

    public MarketSession getSession() {
        return session;
    }

    /**
     * Queue a request.
     *
     * @return number of requests waiting, including this one
     */
    public int submit(MarketRequest request) {
        pending.addLast(request);
        log.debug("Queued {} from {} ({} pending)", request.getType(), request.getParticipantId(), pending.size());
        return pending.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Apply every queued request in arrival order.
     */
    public List<ProcessedRequest> processPending() {
        List<ProcessedRequest> processed = new ArrayList<>();
        while (!pending.isEmpty()) {
            MarketRequest request = pending.removeFirst();
            processed.add(new ProcessedRequest(request, apply(request)));
        }
        return processed;
    }

    /**
     * Apply one request immediately.
     */
    public OperationResult<?> apply(MarketRequest request) {
        if (request.getType().isTargeted()) {
            String target = request.getTargetId();
            if (target == null || target.isEmpty()) {
                return OperationResult.validation(request.getType() + " needs a target id");
            }
            Optional<String> owner = session.ownerOf(target);
            if (owner.isPresent() && !owner.get().equals(request.getParticipantId())) {
                log.warn("{} tried {} on {} owned by {}", request.getParticipantId(), request.getType(),
                        target, owner.get());
                return OperationResult.validation(target + " belongs to another participant");
            }
        }

        OperationResult<?> result = dispatch(request);
        if (result.isSuccess()) {
            StateChange change = new StateChange(++sequence, session.currentHour(), request.getParticipantId(),
                    request.getType(), targetOf(request, result), summarize(request, result));
            broadcaster.broadcast(change);
        } else {
            log.debug("{} from {} refused: {}", request.getType(), request.getParticipantId(), result.getError());
        }
        return result;
    }

    private OperationResult<?> dispatch(MarketRequest request) {
        String participant = request.getParticipantId();
        String target = request.getTargetId();
        switch (request.getType()) {
            case REQUEST_SEARCH:
                return session.requestSearch(participant, request.getCategory(),
                        request.getQualityTier(), request.getTier());
            case RENEW_SEARCH:
                return session.renewSearch(target);
            case CANCEL_SEARCH:
                return session.cancelSearch(target);
            case VIEW_LISTING:
                return session.viewListing(target, participant);
            case SUBMIT_OFFER:
                return session.submitOffer(target, participant, request.getAmount());
            case ACCEPT_COUNTER:
                return session.acceptCounter(target, participant);
            case STAND_FIRM:
                return session.standFirm(target, participant);
            case PURCHASE_LISTING:
                return session.purchaseListing(target, participant);
            case LIST_FOR_SALE:
                return session.listForSale(participant, request.getItem(), request.getTier());
            case CANCEL_SALE:
                return session.cancelSale(target);
            case ACCEPT_OFFER:
                return session.acceptOffer(target);
            case DECLINE_OFFER:
                return session.declineOffer(target);
            case REQUEST_INSPECTION:
                return session.requestInspection(target, request.getTier());
            case CANCEL_INSPECTION:
                return session.cancelInspection(target);
            default:
                log.warn("Unknown request type: {}", request.getType());
                return OperationResult.validation("Unknown request type " + request.getType());
        }
    }

    private static String targetOf(MarketRequest request, OperationResult<?> result) {
        Object value = result.value().orElse(null);
        if (value instanceof SearchView) {
            return ((SearchView) value).getId();
        }
        if (value instanceof SaleView && request.getTargetId() == null) {
            return ((SaleView) value).getId();
        }
        return request.getTargetId();
    }

    private static String summarize(MarketRequest request, OperationResult<?> result) {
        Object value = result.value().orElse(null);
        if (value instanceof NegotiationOutcome) {
            return ((NegotiationOutcome) value).describe();
        }
        return request.getType().name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    /**
     * A drained request and what applying it produced.
     */
    @Value
    public static class ProcessedRequest {
        MarketRequest request;
        OperationResult<?> result;
    }
}
