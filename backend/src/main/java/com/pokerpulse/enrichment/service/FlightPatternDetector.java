package com.pokerpulse.enrichment.service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes multi-day structure ("Day 1A", "Flight B", "Final Table") from explicit fields or the game name,
 * and strips it to get the name shared by all flights of one event.
 */
public final class FlightPatternDetector {

    private static final Pattern DAY = Pattern.compile("\\bDay\\s*(\\d+)([A-Z])?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FLIGHT = Pattern.compile("\\bFlight\\s*(?:(\\d+)([A-Z])?|([A-Z]))\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FINAL = Pattern.compile("\\b(Final\\s*(Day|Table)|FT)\\b", Pattern.CASE_INSENSITIVE);
    // "1A", "2B"; letters past H are money suffixes like "5K" rather than flights
    private static final Pattern DAY_LETTER = Pattern.compile("\\b(\\d{1,2})([A-H])\\b");

    private static final Pattern[] BASE_NAME_STRIP = {
            Pattern.compile("\\s*\\b(Super\\s*)?Turbo\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\bHyper(\\s*Turbo)?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\bDeep(\\s*Stack)?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*[-–]\\s*(Day|Flight)\\s*(\\d+|[A-Z])+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\b(Day|Flight)\\s*(\\d+|[A-Z])+\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\bFlight\\s*\\d+[A-Z]?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*[-–]\\s*Final\\s*(Day|Table)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\bFinal\\s*(Day|Table)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*[-–]?\\s*\\bFT\\b"),
            Pattern.compile("\\s+\\d{1,2}[A-H]\\s*$")
    };

    private FlightPatternDetector() {}

    public record FlightInfo(boolean multiDay, Integer dayNumber, String flightLetter, boolean finalDay) {

        public static final FlightInfo SINGLE = new FlightInfo(false, null, null, false);

        /** Flight identifier used for completeness checks: "1A", "2", "FINAL". A bare letter implies day 1. */
        public String flightId() {
            if (finalDay) return "FINAL";
            int day = dayNumber != null ? dayNumber : 1;
            return flightLetter != null ? day + flightLetter : String.valueOf(day);
        }
    }

    public static FlightInfo detect(String name, Integer dayNumber, String flightLetter, Boolean finalDay) {
        boolean multi = false;
        Integer day = null;
        String letter = null;
        boolean fin = false;
        if (dayNumber != null && dayNumber > 0) {
            multi = true;
            day = dayNumber;
        }
        if (flightLetter != null && !flightLetter.isBlank()) {
            multi = true;
            letter = flightLetter.trim().toUpperCase(Locale.ROOT);
        }
        if (Boolean.TRUE.equals(finalDay)) {
            multi = true;
            fin = true;
        }
        if (multi || name == null) {
            return multi ? new FlightInfo(true, day, letter, fin) : FlightInfo.SINGLE;
        }

        Matcher m = DAY.matcher(name);
        if (m.find()) {
            multi = true;
            day = Integer.parseInt(m.group(1));
            if (m.group(2) != null) letter = m.group(2).toUpperCase(Locale.ROOT);
        }
        m = FLIGHT.matcher(name);
        if (m.find()) {
            multi = true;
            // "Flight 2" carries a day number only, "Flight B" a letter only
            if (m.group(1) != null && day == null) day = Integer.parseInt(m.group(1));
            String l = m.group(1) != null ? m.group(2) : m.group(3);
            if (l != null) letter = l.toUpperCase(Locale.ROOT);
        }
        if (FINAL.matcher(name).find()) {
            multi = true;
            fin = true;
        }
        m = DAY_LETTER.matcher(name);
        if (day == null && m.find()) {
            multi = true;
            day = Integer.parseInt(m.group(1));
            letter = m.group(2);
        }
        return multi ? new FlightInfo(true, day, letter, fin) : FlightInfo.SINGLE;
    }

    public static String baseName(String name) {
        if (name == null) return "";
        String s = name;
        for (Pattern p : BASE_NAME_STRIP) {
            s = p.matcher(s).replaceAll("");
        }
        return s.replaceAll("\\s+", " ")
                .replaceAll("[\\s\\-–:|,]+$", "")
                .trim();
    }
}
