package com.shlokmestry.gatekeeper.bans;

import com.shlokmestry.gatekeeper.net.Cidr;

public record NetworkRange(long id, long banId, Cidr cidr) {}
