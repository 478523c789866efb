package eu.fbk.amr2rdf.internal;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ANSIConstants;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;

/**
 * Logging helpers: MDC snapshot/restore and Logback converters used by the bundled logging
 * configurations.
 * <p>
 * The translation engine stores in the MDC key {@value #MDC_CONTEXT} an identifier of the
 * document being processed, so that log lines can be traced back to their input.
 * </p>
 */
public final class Logging {

    private static final Logger LOGGER = LoggerFactory.getLogger(Logging.class);

    public static final String MDC_CONTEXT = "context";

    private Logging() {
    }

    @Nullable
    public static Map<String, String> getMDC() {
        try {
            return MDC.getCopyOfContextMap();
        } catch (final Throwable ex) {
            LOGGER.warn("Could not retrieve MDC map", ex);
            return null;
        }
    }

    public static void setMDC(@Nullable final Map<String, String> mdc) {
        try {
            MDC.setContextMap(mdc == null ? Maps.<String, String>newHashMap() : mdc);
        } catch (final Throwable ex) {
            LOGGER.warn("Could not update MDC map", ex);
        }
    }

    public static final class NormalConverter extends
            ForegroundCompositeConverterBase<ILoggingEvent> {

        @Override
        protected String getForegroundColorCode(final ILoggingEvent event) {
            switch (event.getLevel().toInt()) {
            case Level.ERROR_INT:
                return ANSIConstants.RED_FG;
            case Level.WARN_INT:
                return ANSIConstants.MAGENTA_FG;
            default:
                return ANSIConstants.DEFAULT_FG;
            }
        }

    }

    public static final class BoldConverter extends
            ForegroundCompositeConverterBase<ILoggingEvent> {

        @Override
        protected String getForegroundColorCode(final ILoggingEvent event) {
            switch (event.getLevel().toInt()) {
            case Level.ERROR_INT:
                return ANSIConstants.BOLD + ANSIConstants.RED_FG;
            case Level.WARN_INT:
                return ANSIConstants.BOLD + ANSIConstants.MAGENTA_FG;
            default:
                return ANSIConstants.BOLD + ANSIConstants.DEFAULT_FG;
            }
        }

    }

    /**
     * Renders the MDC context, if any, followed by the logger name for warnings and errors.
     */
    public static final class ContextConverter extends ClassicConverter {

        @Override
        public String convert(final ILoggingEvent event) {
            final Map<String, String> mdc = event.getMDCPropertyMap();
            final String context = mdc == null ? null : mdc.get(MDC_CONTEXT);
            final String logger = event.getLevel().toInt() >= Level.WARN_INT ? event
                    .getLoggerName() : null;
            if (context == null) {
                return logger == null ? "" : "[" + logger + "] ";
            } else {
                return logger == null ? "[" + context + "] " : "[" + context + "][" + logger
                        + "] ";
            }
        }

    }

}
