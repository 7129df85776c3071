package de.entwicklertraining.chat.fetcher.repetition;

/**
 * @param mostRepeatedLine     the trimmed non-empty line that occurs most often, empty if there is none
 * @param numberOfRepetitions  how often that line occurs
 * @param totalLines           number of lines in the text
 */
public record LineRepetitionStats(String mostRepeatedLine, int numberOfRepetitions, int totalLines) {
}
