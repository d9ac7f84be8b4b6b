package com.shlokmestry.gatekeeper.net;

import java.time.Instant;
import java.util.List;

public record BanRanges(long banId, Instant expiresAt, List<Cidr> ranges) {}
