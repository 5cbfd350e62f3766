package com.ironcondor.analysis;

import com.ironcondor.domain.model.PayoffPoint;
import com.ironcondor.domain.model.StrikeSet;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Expiration P&L of the combined four-leg position.
 *
 * <p>The curve is piecewise linear with breakpoints exactly at the four strikes:
 * <pre>
 *   call spread: 0 below shortCall, -(U - shortCall) between, -(longCall - shortCall) above longCall
 *   put spread:  0 above shortPut,  -(shortPut - U) between,  -(shortPut - longPut) below longPut
 *   total = (call + put) * 100 * contracts + netCredit
 * </pre>
 * {@code netCredit} is the total dollar credit, already scaled by contracts.
 */
@Component
public class PayoffEvaluator {

    public static final int SHARES_PER_CONTRACT = 100;

    public double pnlAt(double underlyingPrice, StrikeSet strikes, double netCredit, int contracts) {
        double callPnl = callSpreadPnl(underlyingPrice, strikes);
        double putPnl = putSpreadPnl(underlyingPrice, strikes);
        return (callPnl + putPnl) * SHARES_PER_CONTRACT * contracts + netCredit;
    }

    /**
     * Samples the curve at {@code samples} evenly spaced prices from {@code low} to
     * {@code high}, both ends included. Prices and P&L are rounded to 2 decimals.
     */
    public List<PayoffPoint> curve(
            StrikeSet strikes, double netCredit, int contracts, double low, double high, int samples) {
        List<PayoffPoint> points = new ArrayList<>(samples);
        double step = samples > 1 ? (high - low) / (samples - 1) : 0.0;
        for (int i = 0; i < samples; i++) {
            double price = i == samples - 1 && samples > 1 ? high : low + i * step;
            points.add(new PayoffPoint(
                    Rounding.money(price), Rounding.money(pnlAt(price, strikes, netCredit, contracts))));
        }
        return points;
    }

    private static double callSpreadPnl(double u, StrikeSet strikes) {
        if (u <= strikes.getShortCall()) {
            return 0.0;
        }
        if (u >= strikes.getLongCall()) {
            return -(strikes.getLongCall() - strikes.getShortCall());
        }
        return -(u - strikes.getShortCall());
    }

    private static double putSpreadPnl(double u, StrikeSet strikes) {
        if (u >= strikes.getShortPut()) {
            return 0.0;
        }
        if (u <= strikes.getLongPut()) {
            return -(strikes.getShortPut() - strikes.getLongPut());
        }
        return -(strikes.getShortPut() - u);
    }
}
