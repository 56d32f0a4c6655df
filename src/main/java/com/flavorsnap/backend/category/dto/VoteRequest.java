package com.flavorsnap.backend.category.dto;

public record VoteRequest(String voterId, String voteType) {}
