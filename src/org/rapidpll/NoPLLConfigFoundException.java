package org.rapidpll;

public class NoPLLConfigFoundException extends PLLConfigException {

    private final long searchedCandidateNum;

    public NoPLLConfigFoundException(String message, long searchedCandidateNum) {
        super(message);
        this.searchedCandidateNum = searchedCandidateNum;
    }

    public long getSearchedCandidateNum() {
        return searchedCandidateNum;
    }
}
