package org.patternlab.app;

import org.patternlab.behavioral.observer.PhoneDisplay;
import org.patternlab.behavioral.observer.WeatherStation;
import org.patternlab.behavioral.observer.WindowDisplay;
import org.patternlab.behavioral.strategy.Navigator;
import org.patternlab.behavioral.strategy.NavigatorRuntimeBinder;
import org.patternlab.behavioral.strategy.NavigatorRuntimeConfig;
import org.patternlab.behavioral.strategy.RouteStrategyRegistry;
import org.patternlab.core.PatternContractException;
import org.patternlab.creational.factory.Serializer;
import org.patternlab.creational.factory.SerializerFactory;
import org.patternlab.creational.singleton.AppConfig;
import org.patternlab.creational.singleton.AppConfigHolder;
import org.patternlab.structural.adapter.MediaPlayer;
import org.patternlab.structural.adapter.MediaPlayerFactory;
import org.patternlab.structural.adapter.PlaybackReport;
import org.patternlab.structural.decorator.HtmlDecorator;
import org.patternlab.structural.decorator.SimpleText;
import org.patternlab.structural.decorator.TextPublisher;
import org.patternlab.structural.decorator.UpperCaseDecorator;

import java.io.PrintStream;

/**
 * Console driver that walks through every pattern demonstration.
 */
public class Main {
    static final String ORIGIN = "Home";
    static final String DESTINATION = "Office";

    /**
     * Runs all demonstrations against {@code System.out}.
     *
     * @param args command-line arguments (unused).
     */
    public static void main(String[] args) {
        run(System.out);
    }

    static void run(PrintStream out) {
        runStrategy(out);
        runObserver(out);
        runAdapter(out);
        runDecorator(out);
        runFactory(out, "xml");
        runFactory(out, "yaml");
        runSingleton(out);
    }

    static void runStrategy(PrintStream out) {
        RouteStrategyRegistry registry = RouteStrategyRegistry.defaultRegistry();
        Navigator navigator = new NavigatorRuntimeBinder().bind(NavigatorRuntimeConfig.defaultRuntime(), registry);
        out.println(navigator.getDirections(ORIGIN, DESTINATION));

        navigator.setStrategy(registry.require(RouteStrategyRegistry.STRATEGY_WALK));
        out.println(navigator.getDirections(ORIGIN, DESTINATION));
    }

    static void runObserver(PrintStream out) {
        WeatherStation station = new WeatherStation();
        PhoneDisplay phone = new PhoneDisplay();
        WindowDisplay window = new WindowDisplay();
        station.attach(phone);
        station.attach(window);
        station.attach(temperature -> out.println("Broadcast temperature " + temperature));

        station.updateTemperature(50);
        out.println(phone + " updated to " + phone.lastTemperature() + " temperature");
        out.println(window + " updated to " + window.lastTemperature() + " temperature");
    }

    static void runAdapter(PrintStream out) {
        MediaPlayer player = MediaPlayerFactory.create();
        PlaybackReport report = player.play("let_it_be.mp3");
        out.println("Played " + report.getFileName() + " with " + report.getEngine()
                + " at " + report.getSpeed() + "x");
    }

    static void runDecorator(PrintStream out) {
        TextPublisher message = new SimpleText("Hello world");
        out.println(message.publish());

        TextPublisher html = new HtmlDecorator(message);
        out.println(html.publish());

        TextPublisher upper = new UpperCaseDecorator(html);
        out.println(upper.publish());
    }

    static void runFactory(PrintStream out, String format) {
        try {
            Serializer serializer = SerializerFactory.getSerializer(format);
            out.println(serializer.serialize("My business data"));
        } catch (PatternContractException ex) {
            out.println(ex.getMessage());
        }
    }

    static void runSingleton(PrintStream out) {
        AppConfig first = AppConfigHolder.get();
        AppConfig second = AppConfigHolder.get();
        out.println("Is both reference pointing to same memory location - " + (first == second));
    }
}
