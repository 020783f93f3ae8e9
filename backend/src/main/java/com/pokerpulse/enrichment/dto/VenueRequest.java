package com.pokerpulse.enrichment.dto;

public class VenueRequest {
    private String name;
    private String address;
    private String city;

    public VenueRequest() {}

    public VenueRequest(String name, String address, String city) {
        this.name = name;
        this.address = address;
        this.city = city;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
}
