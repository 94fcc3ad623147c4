package model;

public class TravelState {
    private boolean traveling;
    private String  destinationId;
    private int     remainingSeconds;

    public TravelState() { }

    public boolean isTraveling()               { return traveling; }
    public void    setTraveling(boolean t)     { this.traveling = t; }
    public String  getDestinationId()          { return destinationId; }
    public void    setDestinationId(String id) { this.destinationId = id; }
    public int     getRemainingSeconds()       { return remainingSeconds; }
    public void    setRemainingSeconds(int s)  { this.remainingSeconds = s; }

    public void depart(String destinationId, int seconds) {
        this.traveling = true;
        this.destinationId = destinationId;
        this.remainingSeconds = seconds;
    }

    public void clear() {
        traveling = false;
        destinationId = null;
        remainingSeconds = 0;
    }
}
